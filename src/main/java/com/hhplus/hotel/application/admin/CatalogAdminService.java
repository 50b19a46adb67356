package com.hhplus.hotel.application.admin;

import com.hhplus.hotel.application.admin.dto.AddProductCommand;
import com.hhplus.hotel.application.admin.dto.AddRoomCommand;
import com.hhplus.hotel.domain.product.Product;
import com.hhplus.hotel.domain.product.ProductRepository;
import com.hhplus.hotel.domain.room.DuplicateRoomNumberException;
import com.hhplus.hotel.domain.room.Room;
import com.hhplus.hotel.domain.room.RoomRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * CatalogAdminService - 관리자 객실/상품 등록 Application 서비스
 */
@Slf4j
@Service
public class CatalogAdminService {

    private final RoomRepository roomRepository;
    private final ProductRepository productRepository;

    public CatalogAdminService(RoomRepository roomRepository, ProductRepository productRepository) {
        this.roomRepository = roomRepository;
        this.productRepository = productRepository;
    }

    /**
     * @throws DuplicateRoomNumberException 객실 번호 중복
     */
    @Transactional
    public Room addRoom(AddRoomCommand command) {
        if (roomRepository.existsByRoomNumber(command.getRoomNumber())) {
            throw new DuplicateRoomNumberException(command.getRoomNumber());
        }
        Room room = roomRepository.save(Room.createRoom(
                command.getRoomNumber(), command.getRoomType(), command.getTitle(), command.getDescription(),
                command.getPricePerNight(), command.getMaxOccupancy(), command.getAmenities(), command.getImages()));
        log.info("[CatalogAdminService] 객실 등록 - roomId={}, roomNumber={}", room.getRoomId(), room.getRoomNumber());
        return room;
    }

    @Transactional
    public Product addProduct(AddProductCommand command) {
        Product product = productRepository.save(Product.createProduct(
                command.getName(), command.getDescription(), command.getPrice(),
                command.getCategory(), command.getStockQuantity(), command.getImages()));
        log.info("[CatalogAdminService] 상품 등록 - productId={}, name={}", product.getProductId(), product.getName());
        return product;
    }
}
