package com.mybasket.cartservice.service;

import com.mybasket.cartservice.client.CatalogClient;
import com.mybasket.cartservice.config.CartServiceProperties;
import com.mybasket.cartservice.dto.CartItemResponse;
import com.mybasket.cartservice.dto.CartResponse;
import com.mybasket.cartservice.dto.CartSummaryResponse;
import com.mybasket.cartservice.exception.CartItemNotFoundException;
import com.mybasket.cartservice.exception.CartQuantityLimitException;
import com.mybasket.cartservice.exception.ProductNotFoundException;
import com.mybasket.cartservice.mapper.CartMapper;
import com.mybasket.cartservice.model.Cart;
import com.mybasket.cartservice.model.Product;
import com.mybasket.cartservice.repository.CartStore;
import com.mybasket.cartservice.repository.InMemoryCartStore;
import com.mybasket.common.exception.ConcurrentUpdateException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CartService Unit Tests")
class CartServiceImplTest {

    private static final String USER_ID = "user-1";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private CatalogClient catalogClient;

    private final CartMapper cartMapper = Mappers.getMapper(CartMapper.class);
    private CartServiceProperties properties;
    private InMemoryCartStore cartStore;
    private CartServiceImpl cartService;

    @BeforeEach
    void setUp() {
        properties = new CartServiceProperties();
        properties.getCart().setMaxUpdateAttempts(100);
        cartStore = new InMemoryCartStore();
        cartService = new CartServiceImpl(cartStore, catalogClient, cartMapper, properties, CLOCK);

        lenient().when(catalogClient.getProduct("1")).thenReturn(Optional.of(product("1", "10.99")));
        lenient().when(catalogClient.getProduct("2")).thenReturn(Optional.of(product("2", "4.50")));
    }

    private Product product(String id, String price) {
        return Product.builder()
                .id(id)
                .name("Product " + id)
                .price(new BigDecimal(price))
                .description("Description " + id)
                .image("https://images.example/" + id + ".jpg")
                .dataAiHint("hint")
                .build();
    }

    private void assertTotalsConsistent(CartResponse cart) {
        int expectedItems = cart.getItems().stream().mapToInt(CartItemResponse::getQuantity).sum();
        BigDecimal expectedAmount = cart.getItems().stream()
                .map(item -> item.getPrice().multiply(BigDecimal.valueOf(item.getQuantity())))
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
        assertThat(cart.getTotalItems()).isEqualTo(expectedItems);
        assertThat(cart.getTotalAmount()).isEqualByComparingTo(expectedAmount);
    }

    @Nested
    @DisplayName("getCart Tests")
    class GetCartTests {

        @Test
        @DisplayName("should lazily create an empty cart")
        void shouldCreateEmptyCart() {
            CartResponse cart = cartService.getCart(USER_ID);

            assertThat(cart.getId()).isNotBlank();
            assertThat(cart.getUserId()).isEqualTo(USER_ID);
            assertThat(cart.getItems()).isEmpty();
            assertThat(cart.getTotalItems()).isZero();
            assertThat(cart.getTotalAmount()).isEqualByComparingTo("0");
            assertThat(cart.getCreatedAt()).isEqualTo(CLOCK.instant());
        }

        @Test
        @DisplayName("should return the same cart on subsequent reads")
        void shouldReturnSameCart() {
            String firstId = cartService.getCart(USER_ID).getId();

            assertThat(cartService.getCart(USER_ID).getId()).isEqualTo(firstId);
            assertThat(cartStore.size()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("addItem Tests")
    class AddItemTests {

        @Test
        @DisplayName("should compute 32.97 for three units at 10.99")
        void shouldComputeExactTotal() {
            CartResponse cart = cartService.addItem(USER_ID, "1", 3);

            assertThat(cart.getItems()).hasSize(1);
            assertThat(cart.getTotalItems()).isEqualTo(3);
            assertThat(cart.getTotalAmount()).isEqualTo(new BigDecimal("32.97"));
        }

        @Test
        @DisplayName("should default quantity to 1 and snapshot the product")
        void shouldDefaultQuantityAndSnapshot() {
            CartResponse cart = cartService.addItem(USER_ID, "2", null);

            CartItemResponse item = cart.getItems().get(0);
            assertThat(item.getId()).isEqualTo("2");
            assertThat(item.getName()).isEqualTo("Product 2");
            assertThat(item.getQuantity()).isEqualTo(1);
            assertThat(item.getAddedAt()).isEqualTo(CLOCK.instant());
        }

        @Test
        @DisplayName("should accumulate quantity on an existing line")
        void shouldAccumulateQuantity() {
            cartService.addItem(USER_ID, "1", 2);
            CartResponse cart = cartService.addItem(USER_ID, "1", 3);

            assertThat(cart.getItems()).hasSize(1);
            assertThat(cart.getItems().get(0).getQuantity()).isEqualTo(5);
            assertTotalsConsistent(cart);
        }

        @Test
        @DisplayName("should round the exact sum once rather than per line")
        void shouldRoundOnce() {
            when(catalogClient.getProduct("a")).thenReturn(Optional.of(product("a", "0.005")));
            when(catalogClient.getProduct("b")).thenReturn(Optional.of(product("b", "0.005")));

            cartService.addItem(USER_ID, "a", 1);
            CartResponse cart = cartService.addItem(USER_ID, "b", 1);

            assertThat(cart.getTotalAmount()).isEqualTo(new BigDecimal("0.01"));
        }

        @Test
        @DisplayName("should throw ProductNotFoundException and leave the cart untouched")
        void shouldRejectUnknownProduct() {
            cartService.addItem(USER_ID, "1", 1);
            when(catalogClient.getProduct("missing")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> cartService.addItem(USER_ID, "missing", 1))
                    .isInstanceOf(ProductNotFoundException.class)
                    .hasMessage("Product not found");

            assertThat(cartService.getCart(USER_ID).getItems()).hasSize(1);
        }

        @Test
        @DisplayName("should reject non-positive quantity")
        void shouldRejectNonPositiveQuantity() {
            assertThatThrownBy(() -> cartService.addItem(USER_ID, "1", 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should reject an add that would overflow the line quantity")
        void shouldRejectLineQuantityOverflow() {
            cartService.addItem(USER_ID, "1", Integer.MAX_VALUE);

            assertThatThrownBy(() -> cartService.addItem(USER_ID, "1", 1))
                    .isInstanceOf(CartQuantityLimitException.class)
                    .hasMessage("Cart quantity limit exceeded");

            CartResponse cart = cartService.getCart(USER_ID);
            assertThat(cart.getItems().get(0).getQuantity()).isEqualTo(Integer.MAX_VALUE);
            assertThat(cart.getTotalItems()).isEqualTo(Integer.MAX_VALUE);
            assertThat(cart.getTotalAmount()).isPositive();
            assertTotalsConsistent(cart);
        }

        @Test
        @DisplayName("should reject an add that would overflow the cart's total item count")
        void shouldRejectTotalItemsOverflow() {
            cartService.addItem(USER_ID, "1", Integer.MAX_VALUE);

            assertThatThrownBy(() -> cartService.addItem(USER_ID, "2", 1))
                    .isInstanceOf(CartQuantityLimitException.class);

            assertThat(cartService.getCart(USER_ID).getItems()).hasSize(1);
        }

        @Test
        @DisplayName("should not lose updates when two requests add the same product concurrently")
        void shouldSerializeConcurrentAdds() throws Exception {
            ExecutorService executor = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);
            try {
                Future<?> first = executor.submit(() -> {
                    start.await();
                    return cartService.addItem(USER_ID, "1", 1);
                });
                Future<?> second = executor.submit(() -> {
                    start.await();
                    return cartService.addItem(USER_ID, "1", 1);
                });
                start.countDown();
                first.get(5, TimeUnit.SECONDS);
                second.get(5, TimeUnit.SECONDS);
            } finally {
                executor.shutdownNow();
            }

            CartResponse cart = cartService.getCart(USER_ID);
            assertThat(cart.getItems()).hasSize(1);
            assertThat(cart.getItems().get(0).getQuantity()).isEqualTo(2);
            assertTotalsConsistent(cart);
        }

        @Test
        @DisplayName("should keep every unit under heavy contention")
        void shouldKeepEveryUnitUnderContention() throws Exception {
            int threads = 8;
            int addsPerThread = 25;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            try {
                Future<?>[] futures = new Future<?>[threads];
                for (int i = 0; i < threads; i++) {
                    futures[i] = executor.submit(() -> {
                        start.await();
                        for (int j = 0; j < addsPerThread; j++) {
                            cartService.addItem(USER_ID, "1", 1);
                        }
                        return null;
                    });
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            CartResponse cart = cartService.getCart(USER_ID);
            assertThat(cart.getTotalItems()).isEqualTo(threads * addsPerThread);
            assertTotalsConsistent(cart);
        }
    }

    @Nested
    @DisplayName("updateItem Tests")
    class UpdateItemTests {

        @Test
        @DisplayName("should overwrite the quantity")
        void shouldOverwriteQuantity() {
            cartService.addItem(USER_ID, "1", 3);

            CartResponse cart = cartService.updateItem(USER_ID, "1", 7);

            assertThat(cart.getItems().get(0).getQuantity()).isEqualTo(7);
            assertThat(cart.getTotalAmount()).isEqualTo(new BigDecimal("76.93"));
        }

        @Test
        @DisplayName("should remove the line when quantity is zero")
        void shouldRemoveOnZero() {
            cartService.addItem(USER_ID, "1", 3);

            CartResponse cart = cartService.updateItem(USER_ID, "1", 0);

            assertThat(cart.getItems()).isEmpty();
            assertThat(cart.getTotalAmount()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("should reject an update that would overflow the total item count")
        void shouldRejectUpdateOverflow() {
            cartService.addItem(USER_ID, "1", 1);
            cartService.addItem(USER_ID, "2", 1);

            assertThatThrownBy(() -> cartService.updateItem(USER_ID, "1", Integer.MAX_VALUE))
                    .isInstanceOf(CartQuantityLimitException.class);

            assertThat(cartService.getCart(USER_ID).getTotalItems()).isEqualTo(2);
        }

        @Test
        @DisplayName("should throw CartItemNotFoundException for a missing line")
        void shouldRejectMissingLine() {
            assertThatThrownBy(() -> cartService.updateItem(USER_ID, "1", 2))
                    .isInstanceOf(CartItemNotFoundException.class)
                    .hasMessage("Item not found in cart");
        }
    }

    @Nested
    @DisplayName("removeItem and clearCart Tests")
    class RemoveAndClearTests {

        @Test
        @DisplayName("should treat removing an absent product as a no-op")
        void shouldIgnoreAbsentProduct() {
            CartResponse before = cartService.addItem(USER_ID, "1", 2);

            CartResponse after = cartService.removeItem(USER_ID, "not-in-cart");

            assertThat(after.getItems()).isEqualTo(before.getItems());
            assertThat(after.getTotalAmount()).isEqualTo(before.getTotalAmount());
            assertThat(after.getTotalItems()).isEqualTo(before.getTotalItems());
        }

        @Test
        @DisplayName("should restore prior items and totals after add then remove")
        void shouldRoundTrip() {
            CartResponse before = cartService.addItem(USER_ID, "2", 1);

            cartService.addItem(USER_ID, "1", 3);
            CartResponse after = cartService.removeItem(USER_ID, "1");

            assertThat(after.getItems()).isEqualTo(before.getItems());
            assertThat(after.getTotalAmount()).isEqualTo(before.getTotalAmount());
            assertThat(after.getTotalItems()).isEqualTo(before.getTotalItems());
        }

        @Test
        @DisplayName("should empty the cart and zero totals on clear")
        void shouldClear() {
            cartService.addItem(USER_ID, "1", 1);
            cartService.addItem(USER_ID, "2", 4);

            CartResponse cart = cartService.clearCart(USER_ID);

            assertThat(cart.getItems()).isEmpty();
            assertThat(cart.getTotalItems()).isZero();
            assertThat(cart.getTotalAmount()).isEqualByComparingTo("0");
        }
    }

    @Test
    @DisplayName("getSummary should count distinct lines separately from units")
    void shouldSummarize() {
        cartService.addItem(USER_ID, "1", 3);
        cartService.addItem(USER_ID, "2", 2);

        CartSummaryResponse summary = cartService.getSummary(USER_ID);

        assertThat(summary.getItemCount()).isEqualTo(2);
        assertThat(summary.getTotalItems()).isEqualTo(5);
        assertThat(summary.getTotalAmount()).isEqualTo(new BigDecimal("41.97"));
    }

    @Nested
    @DisplayName("Conflict handling Tests")
    class ConflictTests {

        @Mock
        private CartStore conflictingStore;

        @Test
        @DisplayName("should give up with ConcurrentUpdateException when every swap loses")
        void shouldGiveUpAfterMaxAttempts() {
            properties.getCart().setMaxUpdateAttempts(3);
            CartServiceImpl service = new CartServiceImpl(conflictingStore, catalogClient, cartMapper, properties, CLOCK);
            when(conflictingStore.get(USER_ID)).thenAnswer(invocation -> Optional.of(Cart.empty(USER_ID, CLOCK.instant())));
            when(conflictingStore.compareAndSwap(eq(USER_ID), anyLong(), any(Cart.class))).thenReturn(false);

            assertThatThrownBy(() -> service.clearCart(USER_ID))
                    .isInstanceOf(ConcurrentUpdateException.class);

            verify(conflictingStore, times(3)).compareAndSwap(eq(USER_ID), anyLong(), any(Cart.class));
        }
    }
}
