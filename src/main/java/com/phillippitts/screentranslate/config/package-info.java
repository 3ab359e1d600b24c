/**
 * Spring configuration: executors, metrics binders, and explicit wiring of the vision,
 * translation and flow components.
 */
package com.phillippitts.screentranslate.config;
