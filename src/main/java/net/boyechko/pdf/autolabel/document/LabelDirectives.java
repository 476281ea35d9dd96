/*
 * PDF-Auto-Label - Automated label numbering for tagged documents
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.autolabel.document;

/**
 * Per-element instructions for the labelling engine.
 *
 * @param template a template source overriding the configured default, or null
 * @param noLabel whether the element is left unlabelled without consuming a counter value
 */
public record LabelDirectives(String template, boolean noLabel) {
    public static final LabelDirectives NONE = new LabelDirectives(null, false);

    public static LabelDirectives template(String template) {
        return new LabelDirectives(template, false);
    }

    public static LabelDirectives suppressed() {
        return new LabelDirectives(null, true);
    }

    public boolean hasTemplate() {
        return template != null;
    }
}
