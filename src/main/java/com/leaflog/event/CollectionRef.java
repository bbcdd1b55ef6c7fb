package com.leaflog.event;

import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class CollectionRef {

    private boolean verified;
    private String key;

    static CollectionRef read(BorshReader reader) {
        return new CollectionRef(reader.bool(), reader.key());
    }
}
