/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.diagram.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.google.gson.Gson;
import com.google.gson.JsonIOException;
import com.google.gson.JsonParseException;

import io.github.stanio.diagram.model.DanglingReferencePolicy;
import io.github.stanio.diagram.model.RemovalPolicy;

/**
 * Editor and codec settings.  Instances are immutable; the {@code with*}
 * methods return modified copies.
 * <pre>
 * {
 *   "historyLimit": 100,
 *   "removalPolicy": "DETACH",
 *   "danglingReferences": "RETAIN",
 *   "compress": false,
 *   "uriEncodeCompressed": true,
 *   "defaultShapeWidth": 120,
 *   "defaultShapeHeight": 60
 * }</pre>
 * <p>
 * Missing keys take the default values; unknown keys are ignored.</p>
 */
public final class EditorSettings {

    private static final EditorSettings DEFAULTS = new EditorSettings();

    private int historyLimit = 100;
    private RemovalPolicy removalPolicy = RemovalPolicy.DETACH;
    private DanglingReferencePolicy danglingReferences = DanglingReferencePolicy.RETAIN;
    private boolean compress;
    private boolean uriEncodeCompressed = true;
    private double defaultShapeWidth = 120;
    private double defaultShapeHeight = 60;

    private EditorSettings() {
        // defaults
    }

    private EditorSettings(EditorSettings copy) {
        this.historyLimit = copy.historyLimit;
        this.removalPolicy = copy.removalPolicy;
        this.danglingReferences = copy.danglingReferences;
        this.compress = copy.compress;
        this.uriEncodeCompressed = copy.uriEncodeCompressed;
        this.defaultShapeWidth = copy.defaultShapeWidth;
        this.defaultShapeHeight = copy.defaultShapeHeight;
    }

    public static EditorSettings defaults() {
        return DEFAULTS;
    }

    public static EditorSettings load(Path configFile)
            throws IOException, JsonParseException
    {
        try (InputStream fin = Files.newInputStream(configFile);
                Reader text = new InputStreamReader(fin, StandardCharsets.UTF_8)) {
            return load(text);
        }
    }

    public static EditorSettings load(Reader text)
            throws IOException, JsonParseException
    {
        EditorSettings settings;
        try {
            settings = new Gson().fromJson(text, EditorSettings.class);
        } catch (JsonIOException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw e;
        }
        if (settings == null) {
            return DEFAULTS;
        }
        return settings.validate();
    }

    private EditorSettings validate() throws JsonParseException {
        if (historyLimit < 0)
            throw new JsonParseException("Negative historyLimit: " + historyLimit);
        if (removalPolicy == null)
            throw new JsonParseException("null or unknown removalPolicy");
        if (danglingReferences == null)
            throw new JsonParseException("null or unknown danglingReferences");
        if (!(defaultShapeWidth >= 0 && defaultShapeHeight >= 0))
            throw new JsonParseException("Invalid default shape size: "
                    + defaultShapeWidth + " x " + defaultShapeHeight);

        return this;
    }

    /**
     * @return  the maximum number of undoable commands; {@code 0} for
     *          unbounded
     */
    public int historyLimit() {
        return historyLimit;
    }

    public RemovalPolicy removalPolicy() {
        return removalPolicy;
    }

    public DanglingReferencePolicy danglingReferences() {
        return danglingReferences;
    }

    /**
     * @return  whether saved pages are compressed by default
     */
    public boolean compress() {
        return compress;
    }

    public boolean uriEncodeCompressed() {
        return uriEncodeCompressed;
    }

    public double defaultShapeWidth() {
        return defaultShapeWidth;
    }

    public double defaultShapeHeight() {
        return defaultShapeHeight;
    }

    public EditorSettings withHistoryLimit(int limit) {
        if (limit < 0)
            throw new IllegalArgumentException("Negative history limit: " + limit);

        EditorSettings copy = new EditorSettings(this);
        copy.historyLimit = limit;
        return copy;
    }

    public EditorSettings withRemovalPolicy(RemovalPolicy policy) {
        if (policy == null)
            throw new NullPointerException("policy");

        EditorSettings copy = new EditorSettings(this);
        copy.removalPolicy = policy;
        return copy;
    }

    public EditorSettings withDanglingReferences(DanglingReferencePolicy policy) {
        if (policy == null)
            throw new NullPointerException("policy");

        EditorSettings copy = new EditorSettings(this);
        copy.danglingReferences = policy;
        return copy;
    }

    public EditorSettings withCompress(boolean compressed) {
        EditorSettings copy = new EditorSettings(this);
        copy.compress = compressed;
        return copy;
    }

    public EditorSettings withUriEncodeCompressed(boolean uriEncode) {
        EditorSettings copy = new EditorSettings(this);
        copy.uriEncodeCompressed = uriEncode;
        return copy;
    }

    public EditorSettings withDefaultShapeSize(double width, double height) {
        if (!(width >= 0 && height >= 0))
            throw new IllegalArgumentException("Invalid size: " + width + " x " + height);

        EditorSettings copy = new EditorSettings(this);
        copy.defaultShapeWidth = width;
        copy.defaultShapeHeight = height;
        return copy;
    }

    @Override
    public String toString() {
        return "EditorSettings(historyLimit=" + historyLimit
                + ", removalPolicy=" + removalPolicy
                + ", danglingReferences=" + danglingReferences
                + ", compress=" + compress
                + ", uriEncodeCompressed=" + uriEncodeCompressed
                + ", defaultShapeSize=" + defaultShapeWidth
                + "x" + defaultShapeHeight + ")";
    }

}
