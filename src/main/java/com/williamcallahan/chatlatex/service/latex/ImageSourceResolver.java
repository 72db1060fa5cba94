package com.williamcallahan.chatlatex.service.latex;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves the {@code src} of an {@code <img>} tag to an image file the compiler can include.
 */
@FunctionalInterface
public interface ImageSourceResolver {

    /**
     * Resolves an image source.
     *
     * @param source value of the {@code src} attribute
     * @param chatId chat the message belongs to, null when unknown
     * @return path of an existing image file, empty when the image cannot be found
     */
    Optional<Path> resolve(String source, String chatId);
}
