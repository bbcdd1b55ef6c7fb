package com.leaflog.dto;

import com.leaflog.model.IndexStatus;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class IndexResponse {

    private String signature;
    private IndexStatus status;
}
