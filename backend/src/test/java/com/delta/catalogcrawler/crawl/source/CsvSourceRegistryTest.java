package com.delta.catalogcrawler.crawl.source;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.model.Source;
import com.delta.catalogcrawler.crawl.render.RenderMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvSourceRegistryTest {

    @TempDir
    Path tempDir;

    @Test
    void readsSourcesAndSkipsIncompleteRows() throws Exception {
        Path csv = tempDir.resolve("sources.csv");
        Files.writeString(csv, """
            id,display_name,listing_url,weidian_id,taobao_shop,render_mode
            alpha,Alpha,https://alpha.x.yupoo.com/albums,,,raw
            beta,Beta,https://beta.x.yupoo.com/albums,1864913249,,
            ,Nameless,https://nameless.x.yupoo.com/albums,,,
            alpha,Duplicate,https://dup.x.yupoo.com/albums,,,
            gamma,Gamma,https://gamma.x.yupoo.com/albums,,,sideways
            """, StandardCharsets.UTF_8);
        CsvSourceRegistry registry = registry(csv);

        List<Source> sources = registry.allSources();

        assertThat(sources).extracting(Source::id).containsExactly("alpha", "beta", "gamma");
        assertThat(sources.get(0).renderMode()).isEqualTo(RenderMode.RAW);
        assertThat(sources.get(0).displayName()).isEqualTo("Alpha");
        assertThat(sources.get(1).renderMode()).isEqualTo(RenderMode.RENDERED);
        assertThat(sources.get(1).storefrontUrl()).isEqualTo("https://weidian.com/?userid=1864913249");
        assertThat(sources.get(2).renderMode()).isEqualTo(RenderMode.RENDERED);
    }

    @Test
    void findSourcesKeepsRequestOrderAndRejectsUnknownIds() throws Exception {
        Path csv = tempDir.resolve("sources.csv");
        Files.writeString(csv, """
            id,listing_url
            a,https://a.x.yupoo.com/albums
            b,https://b.x.yupoo.com/albums
            """, StandardCharsets.UTF_8);
        CsvSourceRegistry registry = registry(csv);

        assertThat(registry.findSources(List.of("b", "a"))).extracting(Source::id).containsExactly("b", "a");
        assertThat(registry.findSources(List.of())).hasSize(2);
        assertThatThrownBy(() -> registry.findSources(List.of("a", "zzz")))
            .isInstanceOfSatisfying(UnknownSourceException.class, e -> assertThat(e.getSourceId()).isEqualTo("zzz"));
    }

    @Test
    void missingFileGivesEmptyRegistryAndReloadPicksUpNewFile() throws Exception {
        Path csv = tempDir.resolve("later.csv");
        CsvSourceRegistry registry = registry(csv);
        assertThat(registry.allSources()).isEmpty();

        Files.writeString(csv, "id,listing_url\nlate,https://late.x.yupoo.com/albums\n", StandardCharsets.UTF_8);

        assertThat(registry.reload()).isEqualTo(1);
        assertThat(registry.findSource("late")).isPresent();
    }

    private CsvSourceRegistry registry(Path csv) {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getData().setSourcesCsv(csv.toString());
        return new CsvSourceRegistry(properties);
    }
}
