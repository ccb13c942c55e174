/* (C)2026 */
package com.ammann.fleetsync.service;

import com.ammann.fleetsync.config.FleetConfig;
import com.ammann.fleetsync.exception.RegistryException;
import com.ammann.fleetsync.model.App;
import com.ammann.fleetsync.model.Container;
import com.ammann.fleetsync.model.Image;
import com.ammann.fleetsync.persistence.FleetSession;
import com.ammann.fleetsync.runtime.ImageReference;
import com.ammann.fleetsync.runtime.RegistryClient;
import com.ammann.fleetsync.runtime.RegistryImage;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Merges an app's registry tag listing into the persisted images.
 *
 * <p>Images are upserted by layer id and their tag overwritten. Known containers created from
 * {@code user/app:tag} are linked to the image, in both directions.
 */
@ApplicationScoped
public class ImageSynchronizer {

    @Inject RegistryClient registryClient;

    @Inject FleetConfig config;

    @Inject Logger logger;

    /**
     * Synchronizes the images of one app. Nothing is committed here.
     *
     * @param session the unit of work to record changes in
     * @param app     the app to synchronize
     * @return the number of registry entries merged
     * @throws RegistryException if the registry cannot be read or returns an incomplete entry
     */
    public int synchronize(FleetSession session, App app) {
        logger.infof(
                "Fetching images for %s from %s ...", app.getName(), config.registry().url());
        List<RegistryImage> remote = registryClient.listImages(app.getName());

        for (RegistryImage entry : remote) {
            if (entry.layer() == null || entry.layer().isBlank() || entry.name() == null) {
                throw new RegistryException(
                        "Incomplete tag entry for " + app.getName() + ": " + entry);
            }
            Image image = upsert(session, app, entry);

            String imageRef =
                    ImageReference.of(config.registry().user(), app.getName(), image.getTag());
            for (Container container : session.containersByImageRef(imageRef)) {
                link(session, image, container);
            }

            app.addImage(image.getId());
            session.add(image);
        }
        session.add(app);
        return remote.size();
    }

    private Image upsert(FleetSession session, App app, RegistryImage entry) {
        Image image = session.image(entry.layer()).orElse(null);
        if (image != null) {
            logger.infof(
                    "Found existing image %s, updating tag to %s", entry.layer(), entry.name());
            image.setTag(entry.name());
            return image;
        }
        logger.infof("Found new image %s, setting tag to %s", entry.layer(), entry.name());
        return new Image(entry.layer(), app.getName(), entry.name());
    }

    private void link(FleetSession session, Image image, Container container) {
        String previous = container.getImageId();
        if (previous != null && !previous.equals(image.getId())) {
            session.image(previous)
                    .ifPresent(
                            stale -> {
                                stale.unlinkContainer(container.getId());
                                session.add(stale);
                            });
        }
        logger.infof(
                "Found container %s with state: [%s], associated with image: %s, linking",
                container.getId(), container.getState(), image.getId());
        container.setImageId(image.getId());
        image.linkContainer(container.getId());
        session.add(container);
    }
}
