/**
 * Maps exceptions to HTTP error responses.
 */
package com.phillippitts.aerodefect.presentation.exception;
