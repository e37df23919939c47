/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.model;

/**
 * How connector ends referencing ids not found on their page are treated
 * when loading a document.
 */
public enum DanglingReferencePolicy {

    /** The reference is kept verbatim and the end marked dangling. */
    RETAIN,

    /** Loading fails. */
    FAIL

}
