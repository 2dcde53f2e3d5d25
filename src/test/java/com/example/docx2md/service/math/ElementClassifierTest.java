package com.example.docx2md.service.math;

import com.example.docx2md.dto.math.NodeKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ElementClassifierTest {

    @Test
    void classifiesPrefixedTags() {
        assertThat(ElementClassifier.classify("m:f")).isEqualTo(NodeKind.FRACTION);
        assertThat(ElementClassifier.classify("m:rad")).isEqualTo(NodeKind.RADICAL);
        assertThat(ElementClassifier.classify("m:sSup")).isEqualTo(NodeKind.SUPERSCRIPT);
        assertThat(ElementClassifier.classify("m:sSub")).isEqualTo(NodeKind.SUBSCRIPT);
        assertThat(ElementClassifier.classify("m:nary")).isEqualTo(NodeKind.NARY);
        assertThat(ElementClassifier.classify("m:m")).isEqualTo(NodeKind.MATRIX);
        assertThat(ElementClassifier.classify("m:acc")).isEqualTo(NodeKind.ACCENT);
        assertThat(ElementClassifier.classify("m:d")).isEqualTo(NodeKind.DELIMITER);
        assertThat(ElementClassifier.classify("m:r")).isEqualTo(NodeKind.RUN);
    }

    @Test
    void classifiesClarkNotation() {
        assertThat(ElementClassifier.classify("{" + OmmlTreeReader.MATH_NS + "}f"))
                .isEqualTo(NodeKind.FRACTION);
    }

    @Test
    void unknownAndContainerTagsAreGroups() {
        assertThat(ElementClassifier.classify("m:e")).isEqualTo(NodeKind.GROUP);
        assertThat(ElementClassifier.classify("m:oMath")).isEqualTo(NodeKind.GROUP);
        assertThat(ElementClassifier.classify("m:somethingNew")).isEqualTo(NodeKind.GROUP);
        assertThat(ElementClassifier.classify(null)).isEqualTo(NodeKind.GROUP);
    }

    @Test
    void propertyElements() {
        assertThat(ElementClassifier.isProperties("m:fPr")).isTrue();
        assertThat(ElementClassifier.isProperties("m:ctrlPr")).isTrue();
        assertThat(ElementClassifier.isProperties("m:f")).isFalse();
    }

    @Test
    void localName() {
        assertThat(ElementClassifier.localName("m:sSubSup")).isEqualTo("sSubSup");
        assertThat(ElementClassifier.localName("{urn:x}t")).isEqualTo("t");
        assertThat(ElementClassifier.localName("t")).isEqualTo("t");
    }
}
