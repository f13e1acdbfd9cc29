package com.docfusion.core.translator;

import com.docfusion.core.analysis.PlatformContext;
import com.docfusion.core.model.Module;
import com.docfusion.core.plugin.DocContext;

/**
 * Turns the analyzed source files of one platform into a documentation module.
 *
 * <p>Registered on {@link com.docfusion.core.plugin.CoreExtensions#FILE_TRANSLATOR}.
 * Called concurrently for different platforms.
 */
@FunctionalInterface
public interface FileTranslator {

    /**
     * Translates the source files of a platform.
     *
     * @param platform platform to translate
     * @param context run context
     * @return module tagged with {@code platform.platformData()} only
     */
    Module translate(PlatformContext platform, DocContext context);
}
