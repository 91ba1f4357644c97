/**
 * Fast lane: deadline-bounded pattern scan of single chunks.
 */
package com.phillippitts.phiredaction.service.detect.fast;
