package dev.snep.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.assertj.core.api.Assertions.entry;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ElementTest {

    private static Element sample() {
        return Element.root(List.of(
                new Text("intro\n"),
                new Attribute("lang", "en"),
                new Element("foo", List.of(new Text("first\n"))),
                new Attribute("tag", "x"),
                new Element("baz", List.of(new Attribute("k", "v"))),
                new Attribute("lang", "fr"),
                new Element("foo", List.of(new Text("second\n")))));
    }

    @Test
    void accumulatesRepeatedAttributesInDocumentOrder() {
        Element root = sample();

        assertThat(root.attributes()).containsExactly(
                entry("lang", "en\nfr"),
                entry("tag", "x"));
        assertThat(root.attribute("lang")).contains("en\nfr");
        assertThat(root.attribute("missing")).isEmpty();
        assertThat(root.children()).filteredOn(Attribute.class::isInstance).hasSize(3);
    }

    @Test
    void groupsElementsByName() {
        Element root = sample();

        assertThat(root.elements().get("foo")).hasSize(2);
        assertThat(root.elementIndices().get("foo")).containsExactly(2, 6);
        assertThat(root.elementIndices().get("baz")).containsExactly(4);
        assertThat(root.uniqueElements()).containsOnlyKeys("baz");
        assertThat(root.hasUniqueElements()).isFalse();
        assertThat(root.getElement("baz").hasUniqueElements()).isTrue();
    }

    @Test
    void lookupDistinguishesMissingFromAmbiguous() {
        Element root = sample();

        assertThat(root.getElement("baz").attributes()).containsEntry("k", "v");
        assertThat(root.findElement("bar")).isEmpty();
        assertThatThrownBy(() -> root.getElement("bar"))
                .isInstanceOf(ElementNotFoundException.class)
                .hasMessage("element does not exist: bar");

        Throwable thrown = catchThrowable(() -> root.getElement("foo"));
        assertThat(thrown).isInstanceOf(NonUniqueElementException.class);
        assertThat(((NonUniqueElementException) thrown).occurrences()).isEqualTo(2);
        assertThat(((ElementLookupException) thrown).elementName()).isEqualTo("foo");
        assertThatThrownBy(() -> root.findElement("foo")).isInstanceOf(NonUniqueElementException.class);
    }

    @Test
    void replaceElementKeepsPositionAndOriginal() {
        Element root = sample();
        int hashBefore = root.hashCode();
        String renderedBefore = root.render();
        Element replacement = new Element("baz", List.of(new Text("new\n")));

        Element updated = root.replaceElement("baz", replacement);

        assertThat(updated.children().get(4)).isSameAs(replacement);
        assertThat(updated.children().get(2)).isSameAs(root.children().get(2));
        assertThat(updated.children()).hasSameSizeAs(root.children());
        assertThat(root.getElement("baz").attributes()).containsEntry("k", "v");
        assertThat(root.hashCode()).isEqualTo(hashBefore);
        assertThat(root.render()).isEqualTo(renderedBefore);
        assertThat(updated).isNotEqualTo(root);
    }

    @Test
    void replaceElementFailsLikeLookup() {
        Element root = sample();

        assertThatThrownBy(() -> root.replaceElement("bar", new Element("bar", List.of())))
                .isInstanceOf(ElementNotFoundException.class);
        assertThatThrownBy(() -> root.replaceElementChildren("foo", List.of()))
                .isInstanceOf(NonUniqueElementException.class);
    }

    @Test
    void replaceElementChildrenKeepsCommentAndOrigin() {
        Element inner = new Element("box", List.of(new Text("old\n")), Origin.of("lib", 7), " end");
        Element root = Element.root(List.of(inner));

        Element updated = root.replaceElementChildren("box", List.of(new Text("new\n")));

        Element box = updated.getElement("box");
        assertThat(box.children()).containsExactly(new Text("new\n"));
        assertThat(box.trailingComment()).isEqualTo(" end");
        assertThat(box.origin()).isEqualTo(Origin.of("lib", 7));
        assertThat(inner.children()).containsExactly(new Text("old\n"));
    }

    @Test
    void replaceNameKeepsChildren() {
        Element original = new Element("a", List.of(new Attribute("k", "v")));

        Element renamed = original.replaceName("b");

        assertThat(renamed.name()).contains("b");
        assertThat(renamed.children()).isEqualTo(original.children());
        assertThat(original.name()).contains("a");
    }

    @Test
    void equalityIgnoresOriginAndComment() {
        Element located = new Element("a", List.of(new Text("x\n", Origin.of("f", 2))), Origin.of("f", 1), " c");
        Element plain = new Element("a", List.of(new Text("x\n")));

        assertThat(located).isEqualTo(plain);
        assertThat(located.hashCode()).isEqualTo(plain.hashCode());
        assertThat(new Attribute("k", "v", Origin.of("f", 3))).isEqualTo(new Attribute("k", "v"));
        assertThat(Element.root(List.of())).isNotEqualTo(new Element("a", List.of()));
    }

    @Test
    void childrenAreDefensivelyCopiedAndUnmodifiable() {
        List<Node> source = new ArrayList<>(List.of(new Text("a\n")));
        Element element = new Element("e", source);

        source.add(new Text("b\n"));

        assertThat(element.children()).hasSize(1);
        assertThatThrownBy(() -> element.children().add(new Text("c\n")))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> element.attributes().put("k", "v"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void ordersTextBeforeAttributeBeforeElement() {
        List<Node> nodes = new ArrayList<>(List.of(
                new Element("b", List.of()),
                new Attribute("z", "1"),
                new Element("a", List.of(new Text("y"))),
                new Text("t"),
                new Element("a", List.of()),
                Element.root(List.of())));

        nodes.sort(null);

        assertThat(nodes).containsExactly(
                new Text("t"),
                new Attribute("z", "1"),
                Element.root(List.of()),
                new Element("a", List.of()),
                new Element("a", List.of(new Text("y"))),
                new Element("b", List.of()));
    }
}
