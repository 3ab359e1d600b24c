/**
 * Request correlation for log output.
 */
package com.phillippitts.screentranslate.config.logging;
