package com.hhplus.hotel.application.cart;

import com.hhplus.hotel.domain.cart.CartItem;
import com.hhplus.hotel.domain.cart.CartLinePricer;
import com.hhplus.hotel.domain.cart.CartRepository;
import com.hhplus.hotel.domain.cart.CatalogItemNotFoundException;
import com.hhplus.hotel.domain.cart.PricedCartLine;
import com.hhplus.hotel.domain.common.ItemType;
import com.hhplus.hotel.domain.product.Product;
import com.hhplus.hotel.domain.product.ProductRepository;
import com.hhplus.hotel.domain.room.Room;
import com.hhplus.hotel.domain.room.RoomRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * CartLineReader - 장바구니 라인을 현재 카탈로그 가격으로 읽어오는 컴포넌트
 *
 * 장바구니 조회와 주문 생성이 같은 가격 규칙을 쓰도록 한 곳에서 처리한다.
 * 객실/상품은 유형별로 한 번씩 일괄 조회한다 (라인 수만큼 쿼리하지 않음).
 *
 * 트랜잭션은 호출자의 것을 따른다.
 */
@Component
public class CartLineReader {

    private final CartRepository cartRepository;
    private final RoomRepository roomRepository;
    private final ProductRepository productRepository;
    private final CartLinePricer cartLinePricer;

    public CartLineReader(CartRepository cartRepository,
                          RoomRepository roomRepository,
                          ProductRepository productRepository,
                          CartLinePricer cartLinePricer) {
        this.cartRepository = cartRepository;
        this.roomRepository = roomRepository;
        this.productRepository = productRepository;
        this.cartLinePricer = cartLinePricer;
    }

    /**
     * 사용자의 장바구니 라인 (최신순, 가격 계산 포함)
     *
     * @throws CatalogItemNotFoundException 라인이 가리키는 객실/상품이 삭제된 경우
     */
    public List<PricedCartLine> readLines(Long customerId) {
        List<CartItem> items = cartRepository.findByCustomerId(customerId);
        if (items.isEmpty()) {
            return List.of();
        }

        Map<Long, Room> rooms = roomRepository.findAllByIds(idsOf(items, ItemType.ROOM)).stream()
                .collect(Collectors.toMap(Room::getRoomId, Function.identity()));
        Map<Long, Product> products = productRepository.findAllByIds(idsOf(items, ItemType.PRODUCT)).stream()
                .collect(Collectors.toMap(Product::getProductId, Function.identity()));

        return items.stream()
                .map(item -> price(item, rooms, products))
                .collect(Collectors.toList());
    }

    private PricedCartLine price(CartItem item, Map<Long, Room> rooms, Map<Long, Product> products) {
        if (item.getItemType() == ItemType.ROOM) {
            Room room = rooms.get(item.getItemId());
            if (room == null) {
                throw new CatalogItemNotFoundException(ItemType.ROOM, item.getItemId());
            }
            return cartLinePricer.price(item, room.getTitle(), room.getPricePerNight(), room.getImages());
        }

        Product product = products.get(item.getItemId());
        if (product == null) {
            throw new CatalogItemNotFoundException(ItemType.PRODUCT, item.getItemId());
        }
        return cartLinePricer.price(item, product.getName(), product.getPrice(), product.getImages());
    }

    private Set<Long> idsOf(List<CartItem> items, ItemType itemType) {
        return items.stream()
                .filter(item -> item.getItemType() == itemType)
                .map(CartItem::getItemId)
                .collect(Collectors.toSet());
    }
}
