package com.regatta.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@Embeddable
public class LocalizedTitle {

    @Column(name = "title_en", length = 128)
    private String en;

    @Column(name = "title_fr", length = 128)
    private String fr;

    @Column(name = "title_ar", length = 128)
    private String ar;

    public LocalizedTitle(String en, String fr, String ar) {
        this.en = en;
        this.fr = fr;
        this.ar = ar;
    }
}
