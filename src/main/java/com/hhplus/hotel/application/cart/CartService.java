package com.hhplus.hotel.application.cart;

import com.hhplus.hotel.application.cart.dto.AddCartItemCommand;
import com.hhplus.hotel.application.cart.dto.AddCartItemResult;
import com.hhplus.hotel.application.cart.dto.CartView;
import com.hhplus.hotel.common.auth.CustomerPrincipal;
import com.hhplus.hotel.common.exception.DomainException;
import com.hhplus.hotel.common.exception.ErrorCode;
import com.hhplus.hotel.domain.cart.CartItem;
import com.hhplus.hotel.domain.cart.CartItemNotFoundException;
import com.hhplus.hotel.domain.cart.CartLinePricer;
import com.hhplus.hotel.domain.cart.CartRepository;
import com.hhplus.hotel.domain.cart.CatalogItemNotFoundException;
import com.hhplus.hotel.domain.cart.InvalidQuantityException;
import com.hhplus.hotel.domain.cart.PricedCartLine;
import com.hhplus.hotel.domain.common.ItemType;
import com.hhplus.hotel.domain.common.vo.StayRange;
import com.hhplus.hotel.domain.product.ProductRepository;
import com.hhplus.hotel.domain.room.Room;
import com.hhplus.hotel.domain.room.RoomRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * CartService - Application 계층
 *
 * 아키텍처:
 * - Domain 계층의 CartRepository 인터페이스에만 의존 (Port)
 * - 사용자 식별은 CustomerPrincipal로 전달받는다
 */
@Slf4j
@Service
public class CartService {

    private final CartRepository cartRepository;
    private final RoomRepository roomRepository;
    private final ProductRepository productRepository;
    private final CartLineReader cartLineReader;
    private final CartLinePricer cartLinePricer;

    public CartService(CartRepository cartRepository,
                       RoomRepository roomRepository,
                       ProductRepository productRepository,
                       CartLineReader cartLineReader,
                       CartLinePricer cartLinePricer) {
        this.cartRepository = cartRepository;
        this.roomRepository = roomRepository;
        this.productRepository = productRepository;
        this.cartLineReader = cartLineReader;
        this.cartLinePricer = cartLinePricer;
    }

    /**
     * 장바구니 조회
     */
    @Transactional(readOnly = true)
    public CartView getCart(CustomerPrincipal customer) {
        List<PricedCartLine> lines = cartLineReader.readLines(customer.getCustomerId());
        return new CartView(customer.getCustomerId(), lines, cartLinePricer.total(lines));
    }

    /**
     * 장바구니에 항목 추가
     *
     * 같은 (유형, 항목, 체크인, 체크아웃) 라인이 있으면 수량을 합산하고, 없으면 새 라인을 만든다.
     *
     * @throws DomainException INVALID_ITEM_TYPE, INVALID_STAY_RANGE
     * @throws InvalidQuantityException 수량 범위 위반
     * @throws CatalogItemNotFoundException 객실/상품이 없거나 판매 중이 아님
     */
    @Transactional
    public AddCartItemResult addItem(CustomerPrincipal customer, AddCartItemCommand command) {
        ItemType itemType = ItemType.from(command.getItemType());
        int quantity = requireQuantity(command.getQuantity());
        StayRange stayRange = itemType == ItemType.ROOM
                ? toStayRange(command)
                : null;

        validateCatalogItem(itemType, command.getItemId());

        Long customerId = customer.getCustomerId();
        Optional<CartItem> existing = cartRepository.findLine(customerId, itemType, command.getItemId(),
                stayRange != null ? stayRange.getCheckIn() : null,
                stayRange != null ? stayRange.getCheckOut() : null);

        if (existing.isPresent()) {
            CartItem line = existing.get();
            line.increaseQuantity(quantity);
            cartRepository.save(line);
            log.info("[CartService] 장바구니 수량 증가 - userId={}, cartItemId={}, quantity={}",
                    customerId, line.getCartItemId(), line.getQuantity());
            return new AddCartItemResult(line.getCartItemId(), false);
        }

        CartItem saved = cartRepository.save(
                CartItem.create(customerId, itemType, command.getItemId(), quantity, stayRange));
        log.info("[CartService] 장바구니 항목 추가 - userId={}, cartItemId={}, type={}, itemId={}",
                customerId, saved.getCartItemId(), itemType.getCode(), saved.getItemId());
        return new AddCartItemResult(saved.getCartItemId(), true);
    }

    /**
     * 장바구니 항목 삭제 (본인 항목만)
     *
     * @throws CartItemNotFoundException 항목이 없거나 다른 사용자의 항목
     */
    @Transactional
    public void removeItem(CustomerPrincipal customer, Long cartItemId) {
        CartItem item = cartRepository.findById(cartItemId)
                .filter(found -> found.isOwnedBy(customer.getCustomerId()))
                .orElseThrow(() -> new CartItemNotFoundException(cartItemId));

        cartRepository.delete(item);
        log.info("[CartService] 장바구니 항목 삭제 - userId={}, cartItemId={}", customer.getCustomerId(), cartItemId);
    }

    /**
     * 장바구니 비우기 (멱등)
     */
    @Transactional
    public void clearCart(CustomerPrincipal customer) {
        int deleted = cartRepository.deleteByCustomerId(customer.getCustomerId());
        log.info("[CartService] 장바구니 비우기 - userId={}, deleted={}", customer.getCustomerId(), deleted);
    }

    private int requireQuantity(Integer quantity) {
        if (quantity == null) {
            throw new InvalidQuantityException(null);
        }
        return quantity;
    }

    /**
     * 두 날짜가 모두 있으면 숙박 기간, 모두 없으면 null, 한쪽만 있으면 오류
     */
    private StayRange toStayRange(AddCartItemCommand command) {
        if (command.getCheckInDate() == null && command.getCheckOutDate() == null) {
            return null;
        }
        return StayRange.ofNullable(command.getCheckInDate(), command.getCheckOutDate())
                .orElseThrow(() -> new DomainException(ErrorCode.INVALID_STAY_RANGE,
                        "체크인/체크아웃 날짜는 함께 입력해야 합니다"));
    }

    private void validateCatalogItem(ItemType itemType, Long itemId) {
        if (itemId == null) {
            throw new DomainException(ErrorCode.INVALID_REQUEST, "item_id는 필수입니다");
        }
        boolean exists = itemType == ItemType.ROOM
                ? roomRepository.findById(itemId).filter(Room::isBookable).isPresent()
                : productRepository.findActiveById(itemId).isPresent();
        if (!exists) {
            throw new CatalogItemNotFoundException(itemType, itemId);
        }
    }
}
