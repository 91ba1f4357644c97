/**
 * Request and response bodies of the REST API.
 */
package com.phillippitts.phiredaction.presentation.dto;
