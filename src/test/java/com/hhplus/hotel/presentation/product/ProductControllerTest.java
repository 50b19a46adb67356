package com.hhplus.hotel.presentation.product;

import com.hhplus.hotel.application.product.ProductService;
import com.hhplus.hotel.domain.product.CategorySummary;
import com.hhplus.hotel.domain.product.Product;
import com.hhplus.hotel.domain.product.ProductNotFoundException;
import com.hhplus.hotel.presentation.ControllerTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ProductController 단위 테스트")
class ProductControllerTest extends ControllerTestSupport {

    private MockMvc mockMvc;

    @Mock
    private ProductService productService;

    @BeforeEach
    void setup() {
        mockMvc = buildMockMvc(new ProductController(productService));
    }

    @Test
    @DisplayName("카테고리별 상품 목록")
    void testGetProducts_ByCategory() throws Exception {
        Product coffee = Product.createProduct("Local Coffee Beans", null, new BigDecimal("18.99"),
                "food", 50, List.of());
        when(productService.getProducts("food")).thenReturn(List.of(coffee));

        mockMvc.perform(get("/products").param("category", "food"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.category").value("food"))
                .andExpect(jsonPath("$.products[0].name").value("Local Coffee Beans"))
                .andExpect(jsonPath("$.products[0].price").value(18.99));
    }

    @Test
    @DisplayName("카테고리 목록 - 상품 수 포함")
    void testGetCategories() throws Exception {
        when(productService.getCategories()).thenReturn(List.of(
                new CategorySummary("food", 2L), new CategorySummary("souvenirs", 2L)));

        mockMvc.perform(get("/products/categories"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.categories[0].category").value("food"))
                .andExpect(jsonPath("$.categories[0].product_count").value(2));
    }

    @Test
    @DisplayName("상품 조회 실패 - 판매 중지 또는 없는 상품은 404")
    void testGetProduct_NotFound() throws Exception {
        when(productService.getProduct(77L)).thenThrow(new ProductNotFoundException(77L));

        mockMvc.perform(get("/products/77"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("PRODUCT_NOT_FOUND"));
    }

    @Test
    @DisplayName("상품 조회 실패 - 숫자가 아닌 ID는 400")
    void testGetProduct_InvalidId() throws Exception {
        mockMvc.perform(get("/products/abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_REQUEST"));
    }
}
