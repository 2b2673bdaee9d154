package work.lcod.pumslabel.api;

import work.lcod.pumslabel.dictionary.HeaderGrammar;

/**
 * Identifies one PUMS data dictionary: survey year plus 1- or 5-year sample.
 */
public record DictionaryTarget(int year, int samplePeriod) {
    public static final int FIRST_YEAR = 2005;
    public static final int FIRST_FIVE_YEAR_SAMPLE = 2009;

    public DictionaryTarget {
        if (samplePeriod != 1 && samplePeriod != 5) {
            throw new IllegalArgumentException("Sample period must be 1 or 5 years, got " + samplePeriod);
        }
        if (year < FIRST_YEAR) {
            throw new IllegalArgumentException("PUMS dictionaries start in " + FIRST_YEAR + ", got " + year);
        }
        if (samplePeriod == 5 && year < FIRST_FIVE_YEAR_SAMPLE) {
            throw new IllegalArgumentException("5-year PUMS samples start in " + FIRST_FIVE_YEAR_SAMPLE + ", got " + year);
        }
    }

    public HeaderGrammar grammar() {
        return HeaderGrammar.forYear(year);
    }

    /** {@code 2016} for a 1-year sample, {@code 2012-2016} for a 5-year one. */
    public String periodLabel() {
        if (samplePeriod == 1) {
            return Integer.toString(year);
        }
        return (year - samplePeriod + 1) + "-" + year;
    }

    public String dictionaryFileName() {
        return "PUMS_Data_Dictionary_" + periodLabel() + ".txt";
    }

    public String dictionaryCacheKey() {
        return "dictionaries/" + dictionaryFileName();
    }

    /** The parsed output depends on the line width, so it is part of the key. */
    public String scriptCacheKey(int lineWidth) {
        return "scripts/pums_labels_" + year + "_" + samplePeriod + "yr_w" + lineWidth + ".do";
    }

    public String display() {
        return year + " " + samplePeriod + "-year";
    }
}
