/**
 * REST controllers. Controllers translate HTTP to service calls and hold no state.
 */
package com.phillippitts.phiredaction.presentation.controller;
