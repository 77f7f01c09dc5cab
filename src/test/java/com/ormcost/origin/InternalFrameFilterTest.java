package com.ormcost.origin;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("InternalFrameFilter")
class InternalFrameFilterTest {

    private final InternalFrameFilter filter = new InternalFrameFilter(List.of(
            "org.hibernate.",
            "com.example.shop.BaseRepository"
    ));

    @Test
    @DisplayName("package prefix should match the whole subtree")
    void packagePrefix_shouldMatchSubpackages() {
        assertThat(filter.isInternal("org.hibernate.Session")).isTrue();
        assertThat(filter.isInternal("org.hibernate.engine.spi.SessionImpl")).isTrue();
        assertThat(filter.isInternal("org.hibernatex.Session")).isFalse();
    }

    @Test
    @DisplayName("class entry should match the class and its nested classes only")
    void classEntry_shouldMatchNestedClasses() {
        assertThat(filter.isInternal("com.example.shop.BaseRepository")).isTrue();
        assertThat(filter.isInternal("com.example.shop.BaseRepository$Loader")).isTrue();
        assertThat(filter.isInternal("com.example.shop.BaseRepositoryImpl")).isFalse();
        assertThat(filter.isInternal("com.example.shop.OrderController")).isFalse();
    }

    @Test
    @DisplayName("frames without a class name should be treated as internal")
    void nullClassName_shouldBeInternal() {
        assertThat(filter.isInternal(null)).isTrue();
    }

    @Test
    @DisplayName("should keep its own copy of the prefixes")
    void prefixes_shouldBeCopied() {
        List<String> prefixes = new ArrayList<>(List.of("org.jooq."));
        InternalFrameFilter copy = new InternalFrameFilter(prefixes);

        prefixes.add("com.example.");

        assertThat(copy.getPrefixes()).containsExactly("org.jooq.");
        assertThat(copy.isInternal("com.example.shop.ShopService")).isFalse();
    }
}
