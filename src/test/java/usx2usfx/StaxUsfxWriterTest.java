package usx2usfx;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import javax.xml.stream.XMLStreamException;

import org.junit.jupiter.api.Test;

class StaxUsfxWriterTest
{
    @Test
    void writesRootAndEscapedContent() throws Exception
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        StaxUsfxWriter w = new StaxUsfxWriter(out);

        w.startElement("book");
        w.attribute("id", "GEN");
        w.text("Cain & Abel");
        w.elementWithText("caption", "Eden");
        w.endElement();
        w.close();

        String xml = out.toString(StandardCharsets.UTF_8);
        assertThat(xml).startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"?>");
        assertThat(xml).contains("<usfx xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\" "
            + "xsi:noNamespaceSchemaLocation=\"usfx.xsd\">");
        assertThat(xml).endsWith("<book id=\"GEN\">Cain &amp; Abel<caption>Eden</caption></book></usfx>");
    }

    @Test
    void closeFinishesOpenElements() throws Exception
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        StaxUsfxWriter w = new StaxUsfxWriter(out);

        w.startElement("book");
        w.startElement("p");
        assertThat(w.depth()).isEqualTo(2);
        w.close();
        w.close();

        assertThat(w.depth()).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8)).endsWith("<book><p></p></book></usfx>");
    }

    @Test
    void nonAsciiTextIsWrittenAsUtf8() throws Exception
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (StaxUsfxWriter w = new StaxUsfxWriter(out))
        {
            w.elementWithText("h", "Ἐν ἀρχῇ");
        }

        assertThat(out.toString(StandardCharsets.UTF_8)).contains("<h>Ἐν ἀρχῇ</h>");
    }

    @Test
    void emptyElementNameIsRejected() throws Exception
    {
        StaxUsfxWriter w = new StaxUsfxWriter(new ByteArrayOutputStream());

        assertThatThrownBy(() -> w.startElement("")).isInstanceOf(XMLStreamException.class);
        assertThat(w.depth()).isZero();
    }

    @Test
    void rootCannotBeClosedThroughTheSink() throws Exception
    {
        StaxUsfxWriter w = new StaxUsfxWriter(new ByteArrayOutputStream());

        assertThatThrownBy(w::endElement).isInstanceOf(XMLStreamException.class);
    }

    @Test
    void writingAfterCloseFails() throws Exception
    {
        StaxUsfxWriter w = new StaxUsfxWriter(new ByteArrayOutputStream());
        w.close();

        assertThatThrownBy(() -> w.startElement("book")).isInstanceOf(XMLStreamException.class);
    }
}
