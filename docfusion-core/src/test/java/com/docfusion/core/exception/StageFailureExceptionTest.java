package com.docfusion.core.exception;

import com.docfusion.core.PipelineStage;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.*;

class StageFailureExceptionTest {

    @Test
    void constructor_describesStageAndCause() {
        IOException cause = new IOException("disk full");

        StageFailureException exception = new StageFailureException(PipelineStage.RENDER, cause);

        assertThat(exception)
            .hasMessage("Stage 'Rendering' failed: disk full")
            .hasCause(cause)
            .isInstanceOf(DocFusionException.class);
        assertThat(exception.getStage()).isEqualTo(PipelineStage.RENDER);
    }

    @Test
    void constructor_causeWithoutMessage_usesTypeName() {
        StageFailureException exception =
            new StageFailureException(PipelineStage.MERGE_MODELS, new NullPointerException());

        assertThat(exception).hasMessage("Stage 'Merging documentation models' failed: NullPointerException");
    }
}
