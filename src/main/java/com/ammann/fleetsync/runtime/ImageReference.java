/* (C)2026 */
package com.ammann.fleetsync.runtime;

/** Builds the image references containers of an app are created from. */
public final class ImageReference {

    private ImageReference() {}

    /**
     * Returns the reference of one tag of an app in the private registry.
     *
     * @param registryUser the registry namespace
     * @param appName      the app (repository) name
     * @param tag          the image tag
     * @return {@code registryUser/appName:tag}
     */
    public static String of(String registryUser, String appName, String tag) {
        return registryUser + "/" + appName + ":" + tag;
    }
}
