package com.docfusion.core.transformer.impl;

import com.docfusion.core.model.DocumentableKind;
import com.docfusion.core.model.Module;
import com.docfusion.core.plugin.DocContext;
import com.docfusion.core.transformer.DocumentableTransformer;
import com.docfusion.core.util.Documentables;

/**
 * Warns about public declarations that lack documentation on some platform, where
 * {@code reportUndocumented} applies. Returns the module unchanged.
 */
public class UndocumentedReporter implements DocumentableTransformer {

    @Override
    public Module transform(Module module, DocContext context) {
        Documentables.walk(module, (packageName, documentable) -> {
            if (documentable.kind() == DocumentableKind.PACKAGE || documentable.kind() == DocumentableKind.MODULE) {
                return;
            }
            documentable.facts().forEach((platform, facts) -> {
                boolean report = context.passFor(platform)
                    .map(pass -> pass.reportUndocumentedFor(packageName))
                    .orElse(false);
                if (report && facts.visibility().isPublicApi() && !facts.hasDocumentation()) {
                    String where = facts.location() != null ? " (" + facts.location() + ")" : "";
                    context.logger().warn("Undocumented: " + documentable.id() + " on " + platform + where);
                }
            });
        });
        return module;
    }
}
