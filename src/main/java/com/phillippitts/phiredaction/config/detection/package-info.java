/**
 * Detection wiring: context model bean and clock.
 */
package com.phillippitts.phiredaction.config.detection;
