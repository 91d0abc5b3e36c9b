package com.xml2md.cli;

import com.xml2md.core.config.ConverterConfig;
import com.xml2md.core.config.ConverterOptions;
import com.xml2md.core.config.OutputProfile;

/**
 * Resolves the converter options once, before a conversion starts.
 *
 * <p>Precedence, lowest first: built-in defaults, the configuration file (its profile, then
 * its option flags), a profile chosen on the command line, then individual command line
 * flags.
 */
public final class OptionsResolver {

    private OptionsResolver() {
    }

    /**
     * Resolves options.
     *
     * @param config loaded configuration file, or defaults
     * @param profileOverride profile chosen on the command line, or null
     * @param noAnchors true if {@code --no-anchors} was given
     * @return resolved options
     */
    public static ConverterOptions resolve(ConverterConfig config, OutputProfile profileOverride, boolean noAnchors) {
        ConverterOptions options = config.toOptions();
        if (profileOverride != null) {
            options = options.withAnchors(profileOverride.anchors());
        }
        if (noAnchors) {
            options = options.withAnchors(false);
        }
        return options;
    }
}
