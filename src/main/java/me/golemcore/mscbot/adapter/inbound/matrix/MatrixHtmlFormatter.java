/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.mscbot.adapter.inbound.matrix;

import com.vladsch.flexmark.html.HtmlRenderer;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.ast.Node;
import com.vladsch.flexmark.util.data.MutableDataSet;

import java.util.regex.Pattern;

/**
 * Converts markdown replies to the HTML body of a Matrix message.
 *
 * <p>
 * Matrix user ids in the text become {@code matrix.to} links, which clients
 * render as pills.
 */
public final class MatrixHtmlFormatter {

    private static final Pattern USER_ID = Pattern.compile("(@[a-z0-9A-Z]+:[a-z0-9A-Z]+\\.[a-z]+)");

    private final Parser parser;
    private final HtmlRenderer renderer;

    public MatrixHtmlFormatter() {
        MutableDataSet options = new MutableDataSet()
                .set(HtmlRenderer.SOFT_BREAK, "<br />\n");
        this.parser = Parser.builder(options).build();
        this.renderer = HtmlRenderer.builder(options).build();
    }

    public String format(String markdown) {
        Node document = parser.parse(markdown == null ? "" : markdown);
        return pillify(renderer.render(document).trim());
    }

    static String pillify(String html) {
        return USER_ID.matcher(html).replaceAll("<a href=\"https://matrix.to/#/$1\">$1</a>");
    }
}
