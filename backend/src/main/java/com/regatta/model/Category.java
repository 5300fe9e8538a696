package com.regatta.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "categories")
public class Category {

    @Id
    @Column(name = "category_id", nullable = false, updatable = false)
    private UUID categoryId;

    @Column(name = "code", nullable = false, length = 32)
    private String code;

    @Enumerated(EnumType.STRING)
    @Column(name = "gender_scope", nullable = false, length = 8)
    private GenderScope genderScope;

    @Column(name = "age_min")
    private Integer ageMin;

    @Column(name = "age_max")
    private Integer ageMax;

    @Column(name = "masters", nullable = false)
    private boolean masters;

    @Embedded
    private LocalizedTitle titles = new LocalizedTitle();

    /**
     * Age is counted in whole years reached during the season year.
     */
    public boolean admitsAge(int seasonAge) {
        if (ageMin != null && seasonAge < ageMin) {
            return false;
        }
        return ageMax == null || seasonAge <= ageMax;
    }
}
