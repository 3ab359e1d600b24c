/**
 * Text extraction from captured images via vision-capable models.
 */
package com.phillippitts.screentranslate.service.vision;
