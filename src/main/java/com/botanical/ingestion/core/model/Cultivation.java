package com.botanical.ingestion.core.model;

import java.util.List;

/**
 * Growing requirements for a herb. Every field is optional: {@code null} means
 * "not reported", which lets a partial update from one provider overlay the
 * fields it knows without clearing the others.
 */
public record Cultivation(
        String cycle,
        String watering,
        String wateringPeriod,
        List<String> sunlight,
        List<String> soil,
        String hardinessMin,
        String hardinessMax,
        String maintenance,
        String careLevel,
        String growthRate,
        Boolean indoor,
        Boolean droughtTolerant,
        Boolean saltTolerant,
        List<String> propagation,
        List<String> pruningMonths
) {

    public Cultivation {
        sunlight = ModelCollections.copyOrNull(sunlight);
        soil = ModelCollections.copyOrNull(soil);
        propagation = ModelCollections.copyOrNull(propagation);
        pruningMonths = ModelCollections.copyOrNull(pruningMonths);
    }

    public static Cultivation empty() {
        return builder().build();
    }

    /**
     * True when no field carries a value.
     */
    public boolean isEmpty() {
        return ModelCollections.allNull(cycle, watering, wateringPeriod, sunlight, soil,
                hardinessMin, hardinessMax, maintenance, careLevel, growthRate,
                indoor, droughtTolerant, saltTolerant, propagation, pruningMonths);
    }

    /**
     * Returns a copy where every non-null field of {@code overlay} replaces this one's.
     */
    public Cultivation overlay(Cultivation overlay) {
        if (overlay == null) {
            return this;
        }
        return new Cultivation(
                pick(overlay.cycle, cycle),
                pick(overlay.watering, watering),
                pick(overlay.wateringPeriod, wateringPeriod),
                pick(overlay.sunlight, sunlight),
                pick(overlay.soil, soil),
                pick(overlay.hardinessMin, hardinessMin),
                pick(overlay.hardinessMax, hardinessMax),
                pick(overlay.maintenance, maintenance),
                pick(overlay.careLevel, careLevel),
                pick(overlay.growthRate, growthRate),
                pick(overlay.indoor, indoor),
                pick(overlay.droughtTolerant, droughtTolerant),
                pick(overlay.saltTolerant, saltTolerant),
                pick(overlay.propagation, propagation),
                pick(overlay.pruningMonths, pruningMonths));
    }

    private static <T> T pick(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String cycle;
        private String watering;
        private String wateringPeriod;
        private List<String> sunlight;
        private List<String> soil;
        private String hardinessMin;
        private String hardinessMax;
        private String maintenance;
        private String careLevel;
        private String growthRate;
        private Boolean indoor;
        private Boolean droughtTolerant;
        private Boolean saltTolerant;
        private List<String> propagation;
        private List<String> pruningMonths;

        public Builder cycle(String cycle) {
            this.cycle = cycle;
            return this;
        }

        public Builder watering(String watering) {
            this.watering = watering;
            return this;
        }

        public Builder wateringPeriod(String wateringPeriod) {
            this.wateringPeriod = wateringPeriod;
            return this;
        }

        public Builder sunlight(List<String> sunlight) {
            this.sunlight = sunlight;
            return this;
        }

        public Builder soil(List<String> soil) {
            this.soil = soil;
            return this;
        }

        public Builder hardiness(String min, String max) {
            this.hardinessMin = min;
            this.hardinessMax = max;
            return this;
        }

        public Builder maintenance(String maintenance) {
            this.maintenance = maintenance;
            return this;
        }

        public Builder careLevel(String careLevel) {
            this.careLevel = careLevel;
            return this;
        }

        public Builder growthRate(String growthRate) {
            this.growthRate = growthRate;
            return this;
        }

        public Builder indoor(Boolean indoor) {
            this.indoor = indoor;
            return this;
        }

        public Builder droughtTolerant(Boolean droughtTolerant) {
            this.droughtTolerant = droughtTolerant;
            return this;
        }

        public Builder saltTolerant(Boolean saltTolerant) {
            this.saltTolerant = saltTolerant;
            return this;
        }

        public Builder propagation(List<String> propagation) {
            this.propagation = propagation;
            return this;
        }

        public Builder pruningMonths(List<String> pruningMonths) {
            this.pruningMonths = pruningMonths;
            return this;
        }

        public Cultivation build() {
            return new Cultivation(cycle, watering, wateringPeriod, sunlight, soil,
                    hardinessMin, hardinessMax, maintenance, careLevel, growthRate,
                    indoor, droughtTolerant, saltTolerant, propagation, pruningMonths);
        }
    }
}
