package io.shuttle.core.body;

import java.nio.charset.StandardCharsets;

/**
 * Request body carrying an already serialized XML document.
 */
public final class XmlBody extends ByteArrayBody {

    public static final String CONTENT_TYPE = "application/xml";

    public XmlBody(String xml) {
        super(xml.getBytes(StandardCharsets.UTF_8), CONTENT_TYPE);
    }
}
