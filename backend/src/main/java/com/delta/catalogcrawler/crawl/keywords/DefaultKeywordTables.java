package com.delta.catalogcrawler.crawl.keywords;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in tables used when the keyword_mappings table holds no rows for a kind.
 */
public final class DefaultKeywordTables {
    private static final KeywordTable BRANDS = buildBrands();
    private static final KeywordTable CATEGORIES = buildCategories();

    private DefaultKeywordTables() {
    }

    public static KeywordTable brands() {
        return BRANDS;
    }

    public static KeywordTable categories() {
        return CATEGORIES;
    }

    public static KeywordTable forKind(KeywordKind kind) {
        return kind == KeywordKind.BRAND ? BRANDS : CATEGORIES;
    }

    private static KeywordTable buildBrands() {
        List<KeywordEntry> out = new ArrayList<>();
        add(out, "Nike", "nike", "swoosh", "air max", "air force", "dunk", "blazer");
        add(out, "Adidas", "adidas", "yeezy", "boost", "ultraboost", "nmd", "superstar");
        add(out, "Jordan", "jordan", "aj1", "aj4", "aj11", "retro");
        add(out, "Supreme", "supreme", "box logo", "bogo");
        add(out, "Off-White", "off-white", "off white", "virgil");
        add(out, "Gucci", "gucci", "gg");
        add(out, "Louis Vuitton", "louis vuitton", "lv", "monogram");
        add(out, "Dior", "dior", "cd", "saddle");
        add(out, "Balenciaga", "balenciaga", "triple s", "speed trainer");
        add(out, "Prada", "prada", "re-nylon");
        add(out, "Fendi", "fendi", "ff");
        add(out, "Burberry", "burberry", "tb");
        add(out, "Stone Island", "stone island", "si", "compass");
        add(out, "Moncler", "moncler", "maya");
        add(out, "Canada Goose", "canada goose", "cg");
        add(out, "The North Face", "north face", "tnf", "nuptse");
        add(out, "Bape", "bape", "bathing ape", "shark hoodie");
        add(out, "Palace", "palace", "tri-ferg");
        add(out, "Stussy", "stussy", "stüssy");
        add(out, "Chrome Hearts", "chrome hearts", "ch");
        add(out, "Fear Of God", "fear of god", "fog", "essentials");
        add(out, "Represent", "represent");
        add(out, "Gallery Dept", "gallery dept");
        add(out, "Trapstar", "trapstar");
        add(out, "Rick Owens", "rick owens", "drkshdw");
        add(out, "Acne Studios", "acne studios", "acne");
        add(out, "Ami", "ami paris", "ami");
        add(out, "Arcteryx", "arcteryx", "arc'teryx");
        add(out, "Palm Angels", "palm angels");
        add(out, "Vetements", "vetements");
        add(out, "Rhude", "rhude");
        add(out, "Amiri", "amiri");
        add(out, "Casablanca", "casablanca");
        add(out, "Hermes", "hermes", "hermès", "birkin", "kelly");
        add(out, "Chanel", "chanel", "cc");
        add(out, "Bottega Veneta", "bottega", "bv", "intrecciato");
        add(out, "Loewe", "loewe", "puzzle");
        add(out, "Celine", "celine", "céline");
        add(out, "Goyard", "goyard");
        add(out, "Golden Goose", "golden goose", "ggdb");
        add(out, "Alexander Mcqueen", "mcqueen", "alexander mcqueen");
        add(out, "Common Projects", "common projects", "cp");
        add(out, "Valentino", "valentino", "vltn");
        add(out, "Versace", "versace", "medusa");
        add(out, "Givenchy", "givenchy");
        add(out, "YSL", "ysl", "saint laurent", "yves saint laurent");
        add(out, "Thom Browne", "thom browne");
        add(out, "Loro Piana", "loro piana");
        add(out, "Zegna", "zegna", "ermenegildo");
        add(out, "Rolex", "rolex", "submariner", "datejust", "daytona");
        add(out, "Omega", "omega", "speedmaster", "seamaster");
        add(out, "Cartier", "cartier", "love", "juste un clou");
        add(out, "Vivienne Westwood", "vivienne westwood", "orb");
        return new KeywordTable(out);
    }

    private static KeywordTable buildCategories() {
        List<KeywordEntry> out = new ArrayList<>();
        add(out, "bags", "bag", "backpack", "purse", "wallet", "tote", "clutch", "handbag", "crossbody",
            "messenger", "satchel", "duffle", "briefcase");
        add(out, "shoes", "shoe", "sneaker", "boot", "sandal", "slipper", "loafer", "trainer", "runner",
            "dunk", "jordan", "yeezy", "force", "air max", "aj1", "aj4");
        add(out, "hoodies", "hoodie", "sweatshirt", "pullover");
        add(out, "tshirts", "t-shirt", "tee");
        add(out, "shirts", "shirt", "polo", "blouse");
        add(out, "jackets", "jacket", "coat", "parka", "bomber", "windbreaker", "down", "puffer", "vest", "gilet");
        add(out, "pants", "pant", "jean", "trouser", "jogger");
        add(out, "shorts", "short");
        add(out, "pants", "cargo", "sweatpant", "legging");
        add(out, "accessories", "belt", "hat", "cap", "scarf", "glove", "beanie", "sunglasses", "glasses", "tie");
        add(out, "watches", "watch");
        add(out, "jewelry", "jewelry", "necklace", "bracelet", "ring", "earring", "chain");
        add(out, "knitwear", "sweater", "cardigan", "knit");
        add(out, "dresses", "dress", "skirt");
        add(out, "suits", "suit", "blazer");
        add(out, "underwear", "underwear");
        add(out, "socks", "sock");
        return new KeywordTable(out);
    }

    private static void add(List<KeywordEntry> out, String value, String... keywords) {
        for (String keyword : keywords) {
            out.add(new KeywordEntry(keyword, value));
        }
    }
}
