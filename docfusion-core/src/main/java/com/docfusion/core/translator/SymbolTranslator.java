package com.docfusion.core.translator;

import com.docfusion.core.analysis.PlatformContext;
import com.docfusion.core.model.Module;
import com.docfusion.core.plugin.DocContext;

/**
 * Turns the symbol groups of one platform's analysis into a documentation module.
 *
 * <p>Registered on {@link com.docfusion.core.plugin.CoreExtensions#SYMBOL_TRANSLATOR}.
 * Called concurrently for different platforms; implementations must not keep per-call state
 * in fields.
 */
@FunctionalInterface
public interface SymbolTranslator {

    /**
     * Translates the symbols of a platform.
     *
     * @param platform platform to translate
     * @param context run context
     * @return module tagged with {@code platform.platformData()} only
     */
    Module translate(PlatformContext platform, DocContext context);
}
