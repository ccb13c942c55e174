/* (C)2026 */
package com.ammann.fleetsync.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * An application published to the private registry.
 *
 * <p>The known images are kept as an insertion-ordered set of layer ids. Images are never pruned,
 * but syncing the same image twice does not record it twice.
 */
public class App implements FleetEntity<App> {

    private final String name;
    private final Set<String> imageIds = new LinkedHashSet<>();

    public App(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public Set<String> getImageIds() {
        return Collections.unmodifiableSet(imageIds);
    }

    /**
     * Records an image as belonging to this app.
     *
     * @param imageId the registry layer id
     * @return {@code true} if the image was not known before
     */
    public boolean addImage(String imageId) {
        return imageIds.add(imageId);
    }

    @Override
    public String key() {
        return name;
    }

    @Override
    public App copy() {
        App copy = new App(name);
        copy.imageIds.addAll(imageIds);
        return copy;
    }

    @Override
    public String toString() {
        return "App[" + name + "]";
    }
}
