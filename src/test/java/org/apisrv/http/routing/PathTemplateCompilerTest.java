package org.apisrv.http.routing;

import org.apisrv.exception.PathTemplateException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PathTemplateCompilerTest {

    @Test
    void rootCompilesToNoSegments() {
        PathTemplate template = PathTemplateCompiler.compile("/");

        assertThat(template.getSegments()).isEmpty();
        assertThat(template.isExact()).isTrue();
        assertThat(template.isHasTrailingSlash()).isFalse();
        assertThat(template.minSegments()).isZero();
    }

    @Test
    void literalTemplateIsExact() {
        PathTemplate template = PathTemplateCompiler.compile("/api/v1/status");

        assertThat(template.getSegments()).containsExactly(
                new Segment.Literal("api"), new Segment.Literal("v1"), new Segment.Literal("status"));
        assertThat(template.isExact()).isTrue();
        assertThat(template.isHasSplat()).isFalse();
    }

    @Test
    void braceSegmentBecomesParam() {
        PathTemplate template = PathTemplateCompiler.compile("/user/{userId}");

        assertThat(template.getSegments()).containsExactly(new Segment.Literal("user"), new Segment.Param("userId"));
        assertThat(template.isExact()).isFalse();
        assertThat(template.isHasSplat()).isFalse();
        assertThat(template.minSegments()).isEqualTo(2);
    }

    @Test
    void bracketSegmentBecomesSplatWithDefaultBounds() {
        PathTemplate template = PathTemplateCompiler.compile("/files/[parts]");

        assertThat(template.getSegments()).containsExactly(
                new Segment.Literal("files"), new Segment.Splat("parts", 1, 32));
        assertThat(template.isHasSplat()).isTrue();
        assertThat(template.isExact()).isFalse();
    }

    @Test
    void splatBoundsAreParsed() {
        assertThat(PathTemplateCompiler.compile("/[x:3]").getSegments())
                .containsExactly(new Segment.Splat("x", 3, 3));
        assertThat(PathTemplateCompiler.compile("/[_x9:2:5]").getSegments())
                .containsExactly(new Segment.Splat("_x9", 2, 5));
    }

    @Test
    void minSegmentsAreSummedFromTheRight() {
        PathTemplate template = PathTemplateCompiler.compile("/a/[x:2:4]/{id}/b");

        assertThat(template.minSegmentsFrom(0)).isEqualTo(5);
        assertThat(template.minSegmentsFrom(1)).isEqualTo(4);
        assertThat(template.minSegmentsFrom(2)).isEqualTo(2);
        assertThat(template.minSegmentsFrom(3)).isEqualTo(1);
        assertThat(template.minSegmentsFrom(4)).isZero();
    }

    @Test
    void trailingSlashIsRecordedAndStripped() {
        PathTemplate template = PathTemplateCompiler.compile("/needs-slash/");

        assertThat(template.isHasTrailingSlash()).isTrue();
        assertThat(template.getSegments()).isEqualTo(List.of(new Segment.Literal("needs-slash")));
        assertThat(template.getTemplate()).isEqualTo("/needs-slash/");
    }

    @Test
    void emptyInnerSegmentStaysLiteral() {
        PathTemplate template = PathTemplateCompiler.compile("/a//b");

        assertThat(template.getSegments()).containsExactly(
                new Segment.Literal("a"), new Segment.Literal(""), new Segment.Literal("b"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"user", "user/{id}", " /x"})
    void templateMustStartWithSlash(String template) {
        assertThatThrownBy(() -> PathTemplateCompiler.compile(template))
                .isInstanceOf(PathTemplateException.class)
                .hasMessageContaining("Bad request handler path");
    }

    @ParameterizedTest
    @ValueSource(strings = {"/{1abc}", "/{a-b}", "/{}", "/{x", "/x}", "/[]", "/[x:a]", "/[x:1:b]", "/[x", "/a{b}"})
    void malformedCapturesAreRejected(String template) {
        assertThatThrownBy(() -> PathTemplateCompiler.compile(template))
                .isInstanceOf(PathTemplateException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"/[x:0]", "/[x:0:3]", "/[x:3:2]", "/[x:99999999999]"})
    void badSplatBoundsAreRejected(String template) {
        assertThatThrownBy(() -> PathTemplateCompiler.compile(template))
                .isInstanceOf(PathTemplateException.class);
    }

    @Test
    void exactIffNoCaptures() {
        assertThat(PathTemplateCompiler.compile("/a/b/c/").isExact()).isTrue();
        assertThat(PathTemplateCompiler.compile("/a/{b}/c").isExact()).isFalse();
        assertThat(PathTemplateCompiler.compile("/a/b/[c]").isExact()).isFalse();
    }

}
