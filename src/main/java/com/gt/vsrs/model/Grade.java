package com.gt.vsrs.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.vsrs.serialization.GradeDeserializer;
import com.gt.vsrs.serialization.GradeSerializer;

@JsonSerialize(using = GradeSerializer.class, as = Integer.class)
@JsonDeserialize(using = GradeDeserializer.class)
public enum Grade {
    Again(0),
    Hard(3),
    Good(4),
    Easy(5);

    private final int quality;

    Grade(int quality) {
        this.quality = quality;
    }

    public int getQuality() {
        return quality;
    }

    public boolean isLapse() {
        return quality < 3;
    }

    // Quality scores above the scale count as Easy, anything below Hard is a failed recall
    public static Grade fromQuality(int quality) {
        if (quality < 0) {
            throw new IllegalArgumentException("Invalid grade quality " + quality);
        }

        if (quality >= Easy.quality) {
            return Easy;
        } else if (quality == Good.quality) {
            return Good;
        } else if (quality == Hard.quality) {
            return Hard;
        }

        return Again;
    }

    public static Grade fromLabel(String label) {
        for (Grade grade : values()) {
            if (grade.name().equalsIgnoreCase(label.strip())) {
                return grade;
            }
        }

        throw new IllegalArgumentException("Unknown grade " + label);
    }
}
