/**
 * Narrow ports to the chat platform's voice transport.
 *
 * <p>The session orchestrator only talks to {@link com.phillippitts.callscribe.gateway.VoiceGateway},
 * {@link com.phillippitts.callscribe.gateway.VoiceConnection} and
 * {@link com.phillippitts.callscribe.gateway.SpeakerAudioSource}. A platform adapter is supplied as a
 * Spring bean; without one {@link com.phillippitts.callscribe.gateway.DetachedVoiceGateway} is used.
 */
package com.phillippitts.callscribe.gateway;
