/* (C)2026 */
package com.ammann.fleetsync.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A registry image, identified by its layer id.
 *
 * <p>The tag is overwritten on every registry sync. {@link #getContainerIds()} is a weak
 * back-reference to the containers observed running this image.
 */
public class Image implements FleetEntity<Image> {

    private final String id;
    private final String appName;
    private String tag;
    private final Set<String> containerIds = new LinkedHashSet<>();

    public Image(String id, String appName, String tag) {
        this.id = id;
        this.appName = appName;
        this.tag = tag;
    }

    public String getId() {
        return id;
    }

    public String getAppName() {
        return appName;
    }

    public String getTag() {
        return tag;
    }

    public void setTag(String tag) {
        this.tag = tag;
    }

    public Set<String> getContainerIds() {
        return Collections.unmodifiableSet(containerIds);
    }

    public void linkContainer(String containerId) {
        containerIds.add(containerId);
    }

    public void unlinkContainer(String containerId) {
        containerIds.remove(containerId);
    }

    @Override
    public String key() {
        return id;
    }

    @Override
    public Image copy() {
        Image copy = new Image(id, appName, tag);
        copy.containerIds.addAll(containerIds);
        return copy;
    }

    @Override
    public String toString() {
        return "Image[" + id + " " + appName + ":" + tag + "]";
    }
}
