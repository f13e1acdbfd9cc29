package com.docfusion.core.transformer;

import com.docfusion.core.model.Module;
import com.docfusion.core.plugin.DocContext;

/**
 * One step of the model transform chain.
 *
 * <p>Registered on {@link com.docfusion.core.plugin.CoreExtensions#DOCUMENTABLE_TRANSFORMER}.
 * Transformers run in registration order, each receiving the previous one's output. The input
 * must be treated as immutable; return a new module to reflect changes.
 */
@FunctionalInterface
public interface DocumentableTransformer {

    /**
     * Transforms a module.
     *
     * @param module current module
     * @param context run context
     * @return transformed module
     */
    Module transform(Module module, DocContext context);
}
