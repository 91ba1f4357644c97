/**
 * HTTP boundary of the redaction engine.
 */
package com.phillippitts.phiredaction.presentation;
