/**
 * Preparation of raw series before modelling: gap filling, chronological
 * train/test splitting and seasonal period conversion.
 *
 * @since 1.0.0
 */
package com.forecastsentinel.core.preprocessing;
