/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.model;

import static io.github.stanio.diagram.model.InvariantViolationException.Kind.UNKNOWN_ELEMENT;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import io.github.stanio.diagram.event.ChangeEvent;
import io.github.stanio.diagram.event.ChangeEvent.Cause;

/**
 * A planned change to the elements of a page: an ordered sequence of
 * insert/remove/replace steps, each recording the exact element values
 * before and after.
 * <p>
 * Edits are values.  {@link #inverse()} is the structural inverse:
 * applying an edit and then its inverse restores the page elements
 * exactly, z-order included.</p>
 *
 * @see  Page#apply(PageEdit)
 * @see  PageOperations
 */
public final class PageEdit {

    enum Op { INSERT, REMOVE, REPLACE }


    static final class Step {

        final Op op;
        final int index;
        final Element before;
        final Element after;

        Step(Op op, int index, Element before, Element after) {
            this.op = op;
            this.index = index;
            this.before = before;
            this.after = after;
        }

        Step inverse() {
            switch (op) {
            case INSERT:
                return new Step(Op.REMOVE, index, after, null);
            case REMOVE:
                return new Step(Op.INSERT, index, null, before);
            default:
                return new Step(Op.REPLACE, index, after, before);
            }
        }

        void applyTo(List<Element> elements) {
            switch (op) {
            case INSERT:
                if (index < 0 || index > elements.size())
                    throw mismatch();
                elements.add(index, after);
                break;
            case REMOVE:
                if (index >= elements.size() || !elements.get(index).equals(before))
                    throw mismatch();
                elements.remove(index);
                break;
            default:
                if (index >= elements.size() || !elements.get(index).equals(before))
                    throw mismatch();
                elements.set(index, after);
            }
        }

        private IllegalStateException mismatch() {
            return new IllegalStateException("Page state doesn't match edit: "
                    + op + " at " + index + " " + (before == null ? after : before));
        }

        @Override
        public String toString() {
            return op + "@" + index + "(" + (before == null ? "" : before.getId())
                    + (after == null ? "" : " -> " + after.getId()) + ")";
        }

    } // class Step


    private final ChangeEvent.Kind kind;
    private final Cause cause;
    private final List<String> affectedIds;
    private final List<Step> steps;

    private PageEdit(ChangeEvent.Kind kind, Cause cause,
                     List<String> affectedIds, List<Step> steps) {
        this.kind = kind;
        this.cause = cause;
        this.affectedIds = affectedIds;
        this.steps = steps;
    }

    public static Builder builder(Page page, ChangeEvent.Kind kind) {
        return new Builder(page, kind);
    }

    public ChangeEvent.Kind getKind() {
        return kind;
    }

    public Cause getCause() {
        return cause;
    }

    public List<String> getAffectedIds() {
        return affectedIds;
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    /**
     * @return  the edit restoring the state this edit was planned against
     */
    public PageEdit inverse() {
        List<Step> reversed = new ArrayList<>(steps.size());
        for (int i = steps.size() - 1; i >= 0; i--) {
            reversed.add(steps.get(i).inverse());
        }
        return new PageEdit(kind, Cause.UNDO, affectedIds,
                Collections.unmodifiableList(reversed));
    }

    /**
     * @return  this edit, re-applied as redo
     */
    public PageEdit redo() {
        return new PageEdit(kind, Cause.REDO, affectedIds, steps);
    }

    /**
     * @throws  IllegalStateException  if {@code elements} doesn't match the
     *          state this edit was planned against
     */
    List<Element> applyTo(List<Element> elements) {
        List<Element> result = new ArrayList<>(elements);
        for (Step step : steps) {
            step.applyTo(result);
        }
        return result;
    }

    @Override
    public String toString() {
        return "PageEdit(" + kind + ", " + cause + ", " + steps + ")";
    }


    /**
     * Plans steps against a working copy of the page elements.  The page
     * itself is not modified.
     */
    public static final class Builder {

        private final Page page;
        private final ChangeEvent.Kind kind;
        private final List<Element> working;
        private final List<Step> steps = new ArrayList<>();
        private final Set<String> affected = new LinkedHashSet<>();

        Builder(Page page, ChangeEvent.Kind kind) {
            this.page = page;
            this.kind = Objects.requireNonNull(kind, "kind");
            this.working = new ArrayList<>(page.getElements());
        }

        public Page page() {
            return page;
        }

        /**
         * @return  the planned value of the given element, or {@code null}
         */
        public Element get(String id) {
            int index = indexOf(id);
            return (index < 0) ? null : working.get(index);
        }

        public Element require(String id) {
            Element element = get(id);
            if (element == null)
                throw new InvariantViolationException(UNKNOWN_ELEMENT, id,
                        "No element " + id + " on page " + page.getId());

            return element;
        }

        public int indexOf(String id) {
            for (int i = 0, len = working.size(); i < len; i++) {
                if (working.get(i).getId().equals(id))
                    return i;
            }
            return -1;
        }

        /**
         * @return  an unmodifiable view of the planned element list
         */
        public List<Element> elements() {
            return Collections.unmodifiableList(working);
        }

        public Builder insert(int index, Element element) {
            Step step = new Step(Op.INSERT, index, null, element);
            step.applyTo(working);
            steps.add(step);
            affected.add(element.getId());
            return this;
        }

        public Builder append(Element element) {
            return insert(working.size(), element);
        }

        public Builder remove(String id) {
            int index = indexOf(id);
            if (index < 0)
                throw new InvariantViolationException(UNKNOWN_ELEMENT, id,
                        "No element " + id + " on page " + page.getId());

            Step step = new Step(Op.REMOVE, index, working.get(index), null);
            step.applyTo(working);
            steps.add(step);
            affected.add(id);
            return this;
        }

        /**
         * Replaces the element with the same id.  No step is recorded if
         * the value doesn't change.
         */
        public Builder replace(Element element) {
            int index = indexOf(element.getId());
            if (index < 0)
                throw new InvariantViolationException(UNKNOWN_ELEMENT, element.getId(),
                        "No element " + element.getId() + " on page " + page.getId());

            Element before = working.get(index);
            if (!before.equals(element)) {
                Step step = new Step(Op.REPLACE, index, before, element);
                step.applyTo(working);
                steps.add(step);
            }
            affected.add(element.getId());
            return this;
        }

        public PageEdit build() {
            return new PageEdit(kind, Cause.EDIT,
                    Collections.unmodifiableList(new ArrayList<>(affected)),
                    Collections.unmodifiableList(new ArrayList<>(steps)));
        }

    } // class Builder


}
