package io.tupla.core;

import java.util.EnumSet;
import java.util.Set;

/**
 * The facade a table is created through. Decides which layout option is accepted and which
 * layouts a facade may wrap.
 */
public enum TableKind {
    SET("ordered", EnumSet.of(Layout.SET, Layout.ORDERED_SET), true),
    BAG("duplicate", EnumSet.of(Layout.BAG, Layout.DUPLICATE_BAG), true),
    KEY_VALUE_SET("ordered", EnumSet.of(Layout.SET, Layout.ORDERED_SET), false),
    /**
     * Raw table creation with an explicit layout; no layout option.
     */
    RAW(null, EnumSet.allOf(Layout.class), true);

    private final String layoutOption;
    private final Set<Layout> layouts;
    private final boolean keyPosAllowed;

    TableKind(String layoutOption, Set<Layout> layouts, boolean keyPosAllowed) {
        this.layoutOption = layoutOption;
        this.layouts = layouts;
        this.keyPosAllowed = keyPosAllowed;
    }

    /**
     * @return the option key choosing between this kind's layouts, or null for {@link #RAW}
     */
    public String layoutOption() {
        return layoutOption;
    }

    public boolean accepts(Layout layout) {
        return layouts.contains(layout);
    }

    public boolean keyPosAllowed() {
        return keyPosAllowed;
    }

    public Layout layoutFor(boolean flag) {
        return switch (this) {
            case SET, KEY_VALUE_SET -> Layout.set(flag);
            case BAG -> Layout.bag(flag);
            case RAW -> throw new IllegalStateException("raw tables carry an explicit layout");
        };
    }
}
