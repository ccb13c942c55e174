/* (C)2026 */
package com.ammann.fleetsync.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One entry of a registry tag listing.
 *
 * @param layer the layer id the tag points to
 * @param name  the tag
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RegistryImage(String layer, String name) {}
