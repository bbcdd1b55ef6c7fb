package com.leaflog.event;

import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class Creator {

    private String address;
    private boolean verified;
    private int share;

    static Creator read(BorshReader reader) {
        return new Creator(reader.key(), reader.bool(), reader.u8());
    }
}
