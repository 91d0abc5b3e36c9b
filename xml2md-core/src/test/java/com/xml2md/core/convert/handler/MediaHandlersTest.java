package com.xml2md.core.convert.handler;

import com.xml2md.core.convert.RenderMode;
import com.xml2md.core.model.DocNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FigureHandler} and {@link ImageHandler}.
 */
class MediaHandlersTest extends HandlerTestBase {

    @Test
    void figure_writesImageWithCaption() {
        DocNode figure = DocNode.builder("figure")
            .child(DocNode.builder("image").attribute("uri", "img/cat.png").build())
            .child(node("caption", "A cat"))
            .build();

        String output = render(state(RenderMode.SECTION, 1), figure);

        assertThat(output).isEqualTo("![A cat](img/cat.png)\n\n");
    }

    @Test
    void figure_withoutCaption_writesEmptyAltText() {
        DocNode figure = DocNode.builder("figure")
            .child(DocNode.builder("image").attribute("uri", "img/cat.png").build())
            .build();

        assertThat(render(state(RenderMode.BODY), figure)).isEqualTo("![](img/cat.png)\n\n");
    }

    @Test
    void image_standalone_writesNothing() {
        DocNode image = DocNode.builder("image").attribute("uri", "img/cat.png").build();

        assertThat(render(state(RenderMode.SECTION, 1), image)).isEmpty();
        assertThat(resultState).isEqualTo(state(RenderMode.SECTION, 1));
    }
}
