package alpha.emitter.examples;

import alpha.emitter.Listener;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static alpha.emitter.examples.ShoppingCart.CHECKED_OUT;
import static alpha.emitter.examples.ShoppingCart.ITEM_ADDED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * Small tests of {@link ShoppingCart}.
 */
final class ShoppingCartTest
{
    @Test
    void happyPath() {
        var cart = new ShoppingCart();
        var reserved = new ArrayList<Object>();
        cart.on(ITEM_ADDED, (ctx, args) -> reserved.add(args[0]));
        Listener receipt = mock(Listener.class);
        cart.once(CHECKED_OUT, receipt);

        cart.addItem("apple");
        cart.addItem("pear");
        var items = cart.checkout();

        assertThat(reserved).containsExactly("apple", "pear");
        assertThat(items).containsExactly("apple", "pear");
        verify(receipt).onEvent(cart, List.of("apple", "pear"));
        assertThat(cart.eventNames()).isEmpty();
    }

    @Test
    void onlyOwnEvents() {
        assertThatThrownBy(() -> new ShoppingCart().on("item added", mock(Listener.class)))
                .isExactlyInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void checkedOut() {
        var cart = new ShoppingCart();
        cart.checkout();
        assertThatThrownBy(() -> cart.addItem("late"))
                .isExactlyInstanceOf(IllegalStateException.class)
                .hasMessage("Cart is checked out.");
    }
}
