package alpha.emitter.examples;

import alpha.emitter.AbstractEventEmitter;
import alpha.emitter.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A shopping cart that emits events when items are added and when the cart is
 * checked out.<p>
 *
 * Only the cart itself emits events. Other components register listeners,
 * which receive the cart as context and the item as the first argument.
 *
 * <pre>
 *   ShoppingCart cart = new ShoppingCart();
 *   cart.on(ShoppingCart.ITEM_ADDED, (c, args) -{@literal >} inventory.reserve((String) args[0]));
 *   cart.once(ShoppingCart.CHECKED_OUT, (c, args) -{@literal >} mailer.sendReceipt((List{@literal <}?{@literal >}) args[0]));
 * </pre>
 */
public final class ShoppingCart extends AbstractEventEmitter
{
    /** Emitted after an item was added, with the item as the only argument. */
    public static final Symbol ITEM_ADDED = Symbol.of("item added");

    /** Emitted after checkout, with an unmodifiable list of all items. */
    public static final Symbol CHECKED_OUT = Symbol.of("checked out");

    private final List<String> items = new ArrayList<>();
    private boolean checkedOut;

    /**
     * Adds an item to the cart.
     *
     * @param item to add
     *
     * @throws NullPointerException if {@code item} is {@code null}
     * @throws IllegalStateException if the cart is checked out
     */
    public void addItem(String item) {
        requireNonNull(item);
        requireNotCheckedOut();
        items.add(item);
        emit(ITEM_ADDED, item);
    }

    /**
     * Checks out the cart.<p>
     *
     * Listeners of items added are removed, no more items can be added.
     *
     * @return the items
     *
     * @throws IllegalStateException if the cart is already checked out
     */
    public List<String> checkout() {
        requireNotCheckedOut();
        checkedOut = true;
        var all = Collections.unmodifiableList(new ArrayList<>(items));
        emit(CHECKED_OUT, all);
        removeAllListeners(ITEM_ADDED);
        return all;
    }

    /**
     * Returns {@code true} only for the cart's own events.
     *
     * @param event key
     *
     * @return {@code true} only for the cart's own events
     */
    @Override
    protected boolean supports(Object event) {
        return event == ITEM_ADDED || event == CHECKED_OUT;
    }

    private void requireNotCheckedOut() {
        if (checkedOut) {
            throw new IllegalStateException("Cart is checked out.");
        }
    }
}
