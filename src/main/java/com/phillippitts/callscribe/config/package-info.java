/**
 * Spring wiring: executors, the selected STT engine, summarization and delivery beans, startup
 * validation and the STT self-test.
 */
package com.phillippitts.callscribe.config;
