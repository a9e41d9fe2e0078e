package io.heygw44.cohort.domain.admin.service;

import io.heygw44.cohort.domain.admin.dto.LoginRequest;
import io.heygw44.cohort.domain.admin.dto.LoginResponse;
import io.heygw44.cohort.domain.admin.entity.Admin;
import io.heygw44.cohort.domain.admin.repository.AdminRepository;
import io.heygw44.cohort.global.exception.BusinessException;
import io.heygw44.cohort.global.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    private final AdminRepository adminRepository;
    private final PasswordEncoder passwordEncoder;

    public LoginResponse authenticate(LoginRequest request) {
        Admin admin = adminRepository.findByEmail(request.email())
                .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_CREDENTIALS));

        if (!passwordEncoder.matches(request.password(), admin.getPasswordHash())) {
            log.warn("운영자 로그인 실패 - adminId={}", admin.getId());
            throw new BusinessException(ErrorCode.INVALID_CREDENTIALS);
        }

        return toResponse(admin);
    }

    public LoginResponse getMe(Long adminId) {
        Admin admin = adminRepository.findById(adminId)
                .orElseThrow(() -> new BusinessException(ErrorCode.RESOURCE_NOT_FOUND));
        return toResponse(admin);
    }

    private LoginResponse toResponse(Admin admin) {
        return new LoginResponse(admin.getId(), admin.getEmail(), admin.getName());
    }
}
