/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.model;

/**
 * What happens to connectors attached to an element being deleted.
 */
public enum RemovalPolicy {

    /**
     * The connector end is detached and pinned at the last known centre of
     * the removed element.
     */
    DETACH,

    /**
     * Attached connectors are deleted as well.
     */
    CASCADE

}
