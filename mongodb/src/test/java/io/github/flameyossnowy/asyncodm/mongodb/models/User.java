package io.github.flameyossnowy.asyncodm.mongodb.models;

import io.github.flameyossnowy.asyncodm.api.annotations.Id;
import io.github.flameyossnowy.asyncodm.api.annotations.MaxLength;
import io.github.flameyossnowy.asyncodm.api.annotations.NonNull;
import io.github.flameyossnowy.asyncodm.api.annotations.Range;
import io.github.flameyossnowy.asyncodm.api.annotations.Repository;

import java.time.Instant;
import java.util.List;

@Repository(name = "users")
public class User {
    @Id
    public String email;

    @NonNull
    @MaxLength(50)
    public String name;

    @Range(min = 0, max = 150)
    public Integer age;

    public Address address;

    public List<String> tags;

    public Status status;

    public Instant joined;

    public User() {}

    public User(String email, String name) {
        this.email = email;
        this.name = name;
    }

    public User(String email, String name, int age) {
        this(email, name);
        this.age = age;
    }
}
