package com.partsbin.core.picking;

/**
 * A line that cannot be picked in full.
 *
 * @param name      display name of the component
 * @param reference BOM reference designator
 * @param required  required quantity
 * @param onHand    stock on hand
 * @param shortfall {@code required - onHand}
 */
public record ShortageItem(String name, String reference, int required, int onHand, int shortfall) {

    static ShortageItem of(PickListEntry entry) {
        return new ShortageItem(entry.displayName(), entry.line().reference(), entry.required(), entry.onHand(), entry.shortfall());
    }
}
