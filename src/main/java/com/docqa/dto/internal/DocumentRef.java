package com.docqa.dto.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentRef {

    private String id;

    private String title;

    private DocumentStatus status;

    public boolean isReady() {
        return status == DocumentStatus.READY;
    }
}
