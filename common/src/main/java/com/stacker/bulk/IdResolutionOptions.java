package com.stacker.bulk;

import com.stacker.schema.DocumentType;
import lombok.Builder;
import lombok.Value;

/**
 * How a bulk action turns its request into ids.
 */
@Value
@Builder
public class IdResolutionOptions {

    public static final IdResolutionOptions DEFAULT = IdResolutionOptions.builder().build();

    /** Document type used when the request does not name one. */
    DocumentType forcedType;

    /** Id field to collect instead of the document type's own id. */
    String idFieldName;

    /** Only documents with a phone number. */
    boolean forceSkipTraced;

    /** Only documents not in any campaign. */
    boolean notInCampaign;

    /** Field to read the ids from, when it differs from the id field. */
    String source;

    boolean addsConstraints() {
        return forceSkipTraced || notInCampaign || source != null;
    }
}
