package com.docqa.dto.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Citation {

    private String documentId;

    private String documentTitle;

    private Integer pageNumber;

    private Integer sequenceIndex;

    private String snippet;
}
