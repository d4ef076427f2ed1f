package com.verdictrag.dto.response;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DeletionAck {

    String documentId;

    boolean deleted;

    int chunksRemoved;
}
