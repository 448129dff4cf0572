package com.phillippitts.callscribe.service.session.event;

import com.phillippitts.callscribe.service.session.LastSessionSnapshot;

/**
 * Published on the session loop after a session has been finalized and reset.
 */
public record SessionFinalizedEvent(LastSessionSnapshot snapshot) {
}
