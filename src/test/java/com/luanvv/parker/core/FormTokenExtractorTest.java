package com.luanvv.parker.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class FormTokenExtractorTest {
    private final FormTokenExtractor extractor = new FormTokenExtractor();

    @Test
    void readsMetaTokenAndDecodesEntities() {
        assertThat(extractor.extractToken("<meta name=\"csrf-token\" content=\"abc&amp;123\">")).isEqualTo("abc&123");
    }

    @Test
    void readsMetaTokenWithContentBeforeName() {
        assertThat(extractor.extractToken("<meta content=\"xyz\" name=\"csrf-token\" />")).isEqualTo("xyz");
    }

    @Test
    void skipsCsrfParamMeta() {
        assertThat(extractor.extractToken(Pages.SIGN_IN)).isEqualTo("login+token==");
    }

    @Test
    void readsHiddenInputInEitherAttributeOrder() {
        assertThat(extractor.extractToken(Pages.URL_CHECK_FORM)).isEqualTo("check-token");
        assertThat(extractor.extractToken("<input type=\"hidden\" value=\"v&#x2F;1\" name=\"authenticity_token\">"))
            .isEqualTo("v/1");
    }

    @Test
    void metaWinsOverHiddenInput() {
        assertThat(extractor.extractToken(Pages.NEW_CANDIDATE_FORM)).isEqualTo("new-token");
    }

    @Test
    void decodesNamedAndNumericEntities() {
        String html = "<input name=\"authenticity_token\" value=\"a&lt;b&gt;c&quot;d&#47;e&#61;f&#x2b;g&#43;h\">";
        assertThat(extractor.extractToken(html)).isEqualTo("a<b>c\"d/e=f+g+h");
    }

    @Test
    void missingTokenIsEmptyOrNamedError() {
        assertThat(extractor.extractToken("<html><body>nothing here</body></html>")).isEmpty();
        assertThat(extractor.extractToken(null)).isEmpty();
        assertThatThrownBy(() -> extractor.requireToken("<p>no form</p>", "login page"))
            .isInstanceOf(TokenExtractionException.class)
            .hasMessageContaining("login page");
    }
}
