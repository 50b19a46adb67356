package com.hhplus.hotel.domain.order;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * ContactInfo - 주문자 연락처 (Embeddable 값 객체)
 *
 * 이름과 전화번호는 필수, 이메일과 요청사항은 선택.
 * 이메일이 있을 때만 고객 확인 알림을 보낸다.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ContactInfo {

    @Column(name = "customer_name", nullable = false)
    private String customerName;

    @Column(name = "customer_phone", nullable = false, length = 50)
    private String customerPhone;

    @Column(name = "customer_email")
    private String customerEmail;

    private ContactInfo(String customerName, String customerPhone, String customerEmail) {
        this.customerName = customerName;
        this.customerPhone = customerPhone;
        this.customerEmail = customerEmail;
    }

    public static ContactInfo of(String customerName, String customerPhone, String customerEmail) {
        if (customerName == null || customerName.isBlank()) {
            throw new IllegalArgumentException("주문자 이름은 필수입니다");
        }
        if (customerPhone == null || customerPhone.isBlank()) {
            throw new IllegalArgumentException("주문자 전화번호는 필수입니다");
        }
        String email = customerEmail == null || customerEmail.isBlank() ? null : customerEmail.trim();
        return new ContactInfo(customerName.trim(), customerPhone.trim(), email);
    }

    public boolean hasEmail() {
        return customerEmail != null;
    }
}
