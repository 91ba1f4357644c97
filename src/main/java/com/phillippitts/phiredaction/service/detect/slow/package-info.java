/**
 * Contextual slow lane: the pluggable {@link com.phillippitts.phiredaction.service.detect.slow.ContextModel},
 * the bundled lexicon model and the mapping of model labels onto PHI labels.
 */
package com.phillippitts.phiredaction.service.detect.slow;
