/**
 * Maps domain exceptions to HTTP error responses.
 */
package com.phillippitts.callscribe.presentation.exception;
