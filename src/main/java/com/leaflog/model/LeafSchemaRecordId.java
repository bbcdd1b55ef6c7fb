package com.leaflog.model;

import lombok.*;

import java.io.Serializable;
import java.math.BigInteger;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @EqualsAndHashCode
public class LeafSchemaRecordId implements Serializable {

    private String treeId;
    private BigInteger nonce;
}
