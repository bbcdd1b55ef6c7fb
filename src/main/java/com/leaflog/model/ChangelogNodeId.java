package com.leaflog.model;

import lombok.*;

import java.io.Serializable;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @EqualsAndHashCode
public class ChangelogNodeId implements Serializable {

    private String treeId;
    private long seq;
    private long nodeIdx;
}
