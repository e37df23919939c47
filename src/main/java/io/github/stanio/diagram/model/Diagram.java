/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.model;

import static io.github.stanio.diagram.model.InvariantViolationException.Kind.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.github.stanio.diagram.event.ChangeBus;
import io.github.stanio.diagram.event.ChangeEvent;
import io.github.stanio.diagram.style.StyleRegistry;
import io.github.stanio.diagram.xml.XMLNode;

/**
 * A multi-page diagram document (draw.io {@code <mxfile>}).  The diagram
 * owns its pages and the {@link ChangeBus} through which every committed
 * change is published.
 * <p>
 * Document metadata is the ordered {@code <mxfile>} attribute map; the
 * {@code id}, {@code name}, and {@code version} entries have dedicated
 * accessors.</p>
 * <p>
 * Not thread-safe.  A diagram is meant to be used by a single thread at a
 * time.</p>
 */
public final class Diagram {

    private static final Logger log = Logger.getLogger(Diagram.class.getName());

    private Map<String, String> metadata;
    private final List<XMLNode> extraNodes;
    private final boolean bareGraphModel;
    private final List<Page> pages;

    private final ChangeBus bus = new ChangeBus();
    private final StyleRegistry styles = new StyleRegistry();

    Diagram(Builder builder) {
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.extraNodes = Collections.unmodifiableList(new ArrayList<>(builder.extraNodes));
        this.bareGraphModel = builder.bareGraphModel;
        this.pages = new ArrayList<>(builder.pages.size());
        for (Page page : builder.pages) {
            checkNewPage(page);
            page.attach(bus);
            pages.add(page);
        }
    }

    /**
     * Creates a diagram with a single blank page.
     */
    public static Diagram create() {
        return builder().page(Page.blank("page-1", "Page-1")).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public ChangeBus getChangeBus() {
        return bus;
    }

    public StyleRegistry getStyles() {
        return styles;
    }

    public String getId() {
        return metadata.get("id");
    }

    public String getName() {
        return metadata.get("name");
    }

    /**
     * @return  the version tag of the producing application, or {@code null}
     */
    public String getVersion() {
        return metadata.get("version");
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    public List<XMLNode> getExtraNodes() {
        return extraNodes;
    }

    /**
     * @return  whether the diagram was read from a bare
     *          {@code <mxGraphModel>} document rather than an
     *          {@code <mxfile>}
     */
    public boolean isBareGraphModel() {
        return bareGraphModel;
    }

    public List<Page> getPages() {
        return Collections.unmodifiableList(pages);
    }

    public int pageCount() {
        return pages.size();
    }

    public Page getPage(int index) {
        return pages.get(index);
    }

    /**
     * @return  the page with the given id, or {@code null}
     */
    public Page getPage(String pageId) {
        for (Page page : pages) {
            if (page.getId().equals(pageId))
                return page;
        }
        return null;
    }

    /**
     * @throws  InvariantViolationException  ({@code UNKNOWN_ELEMENT}) if
     *          there's no such page
     */
    public Page requirePage(String pageId) {
        Page page = getPage(pageId);
        if (page == null)
            throw new InvariantViolationException(UNKNOWN_ELEMENT, pageId,
                    "No page " + pageId);

        return page;
    }

    public int indexOf(String pageId) {
        for (int i = 0, len = pages.size(); i < len; i++) {
            if (pages.get(i).getId().equals(pageId))
                return i;
        }
        return -1;
    }

    /**
     * @return  a page id not used in this diagram
     */
    public String newPageId() {
        for (int n = pages.size() + 1; ; n++) {
            String candidate = "page-" + n;
            if (getPage(candidate) == null)
                return candidate;
        }
    }

    /**
     * Applies the edit to the page it was planned for.
     *
     * @see  Page#apply(PageEdit)
     */
    public void apply(String pageId, PageEdit edit) {
        requirePage(pageId).apply(edit);
    }

    /**
     * Applies a page-list or metadata change and publishes a single
     * change event.
     *
     * @throws  InvariantViolationException  if the change is not valid
     *          for the current state; the diagram is left unchanged
     * @throws  IllegalStateException  if the edit was not planned against
     *          the current state
     */
    public void apply(DiagramEdit edit) {
        bus.checkMutationAllowed();
        Page page = edit.page();
        switch (edit.op()) {
        case INSERT_PAGE:
            if (edit.index() < 0 || edit.index() > pages.size())
                throw new IllegalStateException("Page index out of range: " + edit.index());

            checkNewPage(page);
            page.attach(bus);
            pages.add(edit.index(), page);
            break;

        case REMOVE_PAGE:
            if (edit.index() >= pages.size() || pages.get(edit.index()) != page)
                throw new IllegalStateException("Page " + page.getId()
                        + " not at position " + edit.index());
            if (pages.size() == 1)
                throw new InvariantViolationException(SCOPE_VIOLATION,
                        page.getId(), "Cannot remove the only page");

            pages.remove(edit.index());
            page.attach(null);
            break;

        case UPDATE_PAGE:
            if (pages.indexOf(page) < 0)
                throw new InvariantViolationException(UNKNOWN_ELEMENT,
                        page.getId(), "No page " + page.getId());
            if (!Objects.equals(page.getName(), edit.nameBefore())
                    || !page.getSettings().equals(edit.settingsBefore()))
                throw new IllegalStateException("Page " + page.getId()
                        + " doesn't match edit");

            page.setName(edit.nameAfter());
            page.setSettings(edit.settingsAfter());
            break;

        default:
            if (!new ArrayList<>(metadata.entrySet())
                    .equals(new ArrayList<>(edit.metadataBefore().entrySet())))
                throw new IllegalStateException("Diagram metadata doesn't match edit");

            metadata = edit.metadataAfter();
        }

        log.log(Level.FINE, "Applied {0}", edit);
        String pageId = edit.getPageId();
        bus.publish(new ChangeEvent(edit.getKind(), edit.getCause(), pageId,
                (pageId == null) ? Collections.emptyList()
                                 : Collections.singletonList(pageId)));
    }

    private void checkNewPage(Page page) {
        if (page.bus() != null)
            throw new IllegalArgumentException("Page " + page.getId()
                    + " already belongs to a diagram");

        if (getPage(page.getId()) != null)
            throw new InvariantViolationException(ID_COLLISION,
                    page.getId(), "Duplicate page id: " + page.getId());
    }

    /**
     * Content equality: metadata, pages, and opaque nodes.  The source
     * document form ({@link #isBareGraphModel()}) is not compared.
     */
    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Diagram))
            return false;

        Diagram other = (Diagram) obj;
        return new ArrayList<>(metadata.entrySet())
                        .equals(new ArrayList<>(other.metadata.entrySet()))
                && pages.equals(other.pages)
                && extraNodes.equals(other.extraNodes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metadata, pages);
    }

    @Override
    public String toString() {
        return "Diagram(name=" + getName() + ", pages=" + pages + ")";
    }


    public static final class Builder {

        Map<String, String> metadata = Collections.emptyMap();
        List<XMLNode> extraNodes = Collections.emptyList();
        boolean bareGraphModel;
        final List<Page> pages = new ArrayList<>();

        Builder() {
            // empty
        }

        public Builder metadata(Map<String, String> attributes) {
            this.metadata = Objects.requireNonNull(attributes);
            return this;
        }

        public Builder extraNodes(List<XMLNode> nodes) {
            this.extraNodes = Objects.requireNonNull(nodes);
            return this;
        }

        public Builder bareGraphModel(boolean bare) {
            this.bareGraphModel = bare;
            return this;
        }

        public Builder page(Page page) {
            pages.add(Objects.requireNonNull(page));
            return this;
        }

        /**
         * @throws  InvariantViolationException  ({@code ID_COLLISION}) if
         *          page ids are not unique
         */
        public Diagram build() {
            return new Diagram(this);
        }

    } // class Builder


}
