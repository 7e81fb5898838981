package io.github.flameyossnowy.asyncodm.api.models;

import io.github.flameyossnowy.asyncodm.api.annotations.Embedded;
import io.github.flameyossnowy.asyncodm.api.annotations.Named;
import io.github.flameyossnowy.asyncodm.api.annotations.NonNull;

@Embedded
public class Address {
    @NonNull
    public String city;

    @Named("zip_code")
    public String zipCode;
}
