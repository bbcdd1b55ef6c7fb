package com.leaflog.event;

import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class Uses {

    private int useMethod;
    private long remaining;
    private long total;

    static Uses read(BorshReader reader) {
        return new Uses(reader.u8(), reader.u64(), reader.u64());
    }
}
