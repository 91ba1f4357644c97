/**
 * Context-model supervision: startup load, failure events and bounded restarts with cooldown.
 */
package com.phillippitts.phiredaction.service.detect.watchdog;
