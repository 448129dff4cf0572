/**
 * The voice session state machine.
 *
 * <p>{@link com.phillippitts.callscribe.service.session.SessionCoordinator} drives one session at
 * a time through IDLE, CANDIDATE, JOINING, ACTIVE (or MANUAL_ACTIVE) and FINALIZING on a single
 * loop thread. {@link com.phillippitts.callscribe.service.session.SessionFinalizer} archives,
 * summarizes and delivers the sealed transcript off that thread.
 */
package com.phillippitts.callscribe.service.session;
