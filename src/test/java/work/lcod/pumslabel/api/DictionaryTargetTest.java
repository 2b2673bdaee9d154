package work.lcod.pumslabel.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import work.lcod.pumslabel.dictionary.HeaderGrammar;

class DictionaryTargetTest {
    @Test
    void oneYearNames() {
        var target = new DictionaryTarget(2016, 1);
        assertEquals("2016", target.periodLabel());
        assertEquals("PUMS_Data_Dictionary_2016.txt", target.dictionaryFileName());
        assertEquals("dictionaries/PUMS_Data_Dictionary_2016.txt", target.dictionaryCacheKey());
        assertEquals("scripts/pums_labels_2016_1yr_w244.do", target.scriptCacheKey(244));
        assertEquals("2016 1-year", target.display());
        assertEquals(HeaderGrammar.BEFORE_2017, target.grammar());
    }

    @Test
    void fiveYearNames() {
        var target = new DictionaryTarget(2019, 5);
        assertEquals("2015-2019", target.periodLabel());
        assertEquals("PUMS_Data_Dictionary_2015-2019.txt", target.dictionaryFileName());
        assertEquals("scripts/pums_labels_2019_5yr_w80.do", target.scriptCacheKey(80));
        assertEquals(HeaderGrammar.SINCE_2017, target.grammar());
    }

    @Test
    void rejectsUnknownSamplesAndYears() {
        assertThrows(IllegalArgumentException.class, () -> new DictionaryTarget(2016, 3));
        assertThrows(IllegalArgumentException.class, () -> new DictionaryTarget(2004, 1));
        assertThrows(IllegalArgumentException.class, () -> new DictionaryTarget(2008, 5));
    }
}
