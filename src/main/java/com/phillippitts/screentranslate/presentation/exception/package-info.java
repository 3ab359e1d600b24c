/**
 * Maps domain exceptions to HTTP responses.
 */
package com.phillippitts.screentranslate.presentation.exception;
