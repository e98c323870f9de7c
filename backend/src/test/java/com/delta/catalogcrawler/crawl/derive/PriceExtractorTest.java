package com.delta.catalogcrawler.crawl.derive;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class PriceExtractorTest {

    @Test
    void readsYenPrefixedPrice() {
        assertThat(PriceExtractor.extract("Nike Dunk ¥199")).contains(new PriceMatch(199.0, PriceExtractor.CNY));
        assertThat(PriceExtractor.extract("Hoodie ￥ 88.5")).contains(new PriceMatch(88.5, PriceExtractor.CNY));
    }

    @Test
    void readsCurrencySuffixes() {
        assertThat(PriceExtractor.extract("Jacket 299 CNY")).contains(new PriceMatch(299.0, PriceExtractor.CNY));
        assertThat(PriceExtractor.extract("Belt 150rmb")).contains(new PriceMatch(150.0, PriceExtractor.CNY));
        assertThat(PriceExtractor.extract("Tee 45 yuan")).contains(new PriceMatch(45.0, PriceExtractor.CNY));
    }

    @Test
    void dollarPricesAreTaggedUsd() {
        assertThat(PriceExtractor.extract("Cap $25")).contains(new PriceMatch(25.0, PriceExtractor.USD));
    }

    @Test
    void labelledPriceIsRecognised() {
        assertThat(PriceExtractor.extract("价格：360")).contains(new PriceMatch(360.0, PriceExtractor.CNY));
        assertThat(PriceExtractor.extract("Price: 120")).contains(new PriceMatch(120.0, PriceExtractor.CNY));
    }

    @Test
    void amountsOutsidePlausibleRangeAreRejected() {
        assertThat(PriceExtractor.extract("¥99999")).isEmpty();
        assertThat(PriceExtractor.extract("¥0")).isEmpty();
    }

    @Test
    void textWithoutPriceYieldsNothing() {
        assertThat(PriceExtractor.extract("no price here")).isEqualTo(Optional.empty());
        assertThat(PriceExtractor.extract("AJ1 Retro High 2024")).isEmpty();
        assertThat(PriceExtractor.extract(null)).isEmpty();
    }
}
