/**
 * Mapping of domain exceptions to HTTP responses.
 */
package com.phillippitts.phiredaction.presentation.exception;
