/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.command;

import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.github.stanio.diagram.event.ListenerFailureException;
import io.github.stanio.diagram.model.InvariantViolationException;
import io.github.stanio.diagram.model.Page;
import io.github.stanio.diagram.model.PageEdit;

/**
 * Command changing the elements of a page.  The edit is planned against
 * the page state at the time of execution, and kept for undo and redo.
 *
 * @see  io.github.stanio.diagram.model.PageOperations
 */
public class PageCommand implements Command {

    private static final Logger log = Logger.getLogger(PageCommand.class.getName());

    private final Page page;
    private final String description;
    private final Function<Page, PageEdit> planner;

    private PageEdit edit;

    protected PageCommand(Page page, String description,
                          Function<Page, PageEdit> planner) {
        this.page = Objects.requireNonNull(page, "page");
        this.description = Objects.requireNonNull(description, "description");
        this.planner = Objects.requireNonNull(planner, "planner");
    }

    public static PageCommand of(Page page, String description,
                                 Function<Page, PageEdit> planner) {
        return new PageCommand(page, description, planner);
    }

    public Page getPage() {
        return page;
    }

    /**
     * @return  the edit applied, or {@code null} if not yet executed
     */
    public PageEdit getEdit() {
        return edit;
    }

    @Override
    public void execute() {
        if (edit != null)
            throw new IllegalStateException("Already executed: " + description);

        PageEdit planned = planner.apply(page);
        try {
            page.apply(planned);
        } catch (ListenerFailureException e) {
            edit = planned;
            throw e;
        }
        edit = planned;
    }

    @Override
    public void undo() {
        page.apply(executed().inverse());
    }

    @Override
    public void redo() {
        page.apply(executed().redo());
    }

    private PageEdit executed() {
        if (edit == null)
            throw new IllegalStateException("Not executed: " + description);

        return edit;
    }

    @Override
    public boolean changesModel() {
        return edit == null || !edit.isEmpty();
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public boolean canExecute() {
        if (edit != null)
            return false;

        try {
            page.check(planner.apply(page));
            return true;
        } catch (InvariantViolationException | IllegalArgumentException e) {
            log.log(Level.FINE, "Cannot execute \"{0}\": {1}",
                    new Object[] { description, e.getMessage() });
            return false;
        }
    }

    @Override
    public String toString() {
        return "PageCommand(" + description + ")";
    }

}
