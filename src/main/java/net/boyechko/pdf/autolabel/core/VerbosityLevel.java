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
package net.boyechko.pdf.autolabel.core;

import ch.qos.logback.classic.Level;

/** How much the command-line tool prints, from {@code -q} up to {@code -vv}. */
public enum VerbosityLevel {
    /** Errors and the final result only */
    QUIET(0, Level.ERROR),

    /** Issue groups and the summary */
    NORMAL(1, Level.WARN),

    /** Every assigned label and every individual issue */
    VERBOSE(2, Level.INFO),

    /** Everything, including per-element allocation traces */
    DEBUG(3, Level.DEBUG);

    private final int level;
    private final Level logLevel;

    VerbosityLevel(int level, Level logLevel) {
        this.level = level;
        this.logLevel = logLevel;
    }

    /** The Logback level applied to the application loggers at this verbosity. */
    public Level logLevel() {
        return logLevel;
    }

    public boolean shouldShow(VerbosityLevel requiredLevel) {
        return this.level >= requiredLevel.level;
    }
}
