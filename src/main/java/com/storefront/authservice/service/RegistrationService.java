package com.storefront.authservice.service;

import com.storefront.authservice.dto.RegistrationRequest;
import com.storefront.authservice.dto.RegistrationResponse;

public interface RegistrationService {

    RegistrationResponse registerUser(RegistrationRequest request);
}
