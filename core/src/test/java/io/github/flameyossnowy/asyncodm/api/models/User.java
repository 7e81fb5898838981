package io.github.flameyossnowy.asyncodm.api.models;

import io.github.flameyossnowy.asyncodm.api.annotations.Id;
import io.github.flameyossnowy.asyncodm.api.annotations.MaxLength;
import io.github.flameyossnowy.asyncodm.api.annotations.NonNull;
import io.github.flameyossnowy.asyncodm.api.annotations.Range;
import io.github.flameyossnowy.asyncodm.api.annotations.Repository;

@Repository(name = "users")
public class User {
    @Id
    public String email;

    @NonNull
    @MaxLength(20)
    public String name;

    @Range(min = 0, max = 150)
    public Integer age;

    public Address address;

    public User() {}

    public User(String email, String name) {
        this.email = email;
        this.name = name;
    }
}
