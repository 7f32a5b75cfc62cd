package io.github.sachinnimbal.transferx.fixtures;

import io.github.sachinnimbal.transferx.core.annotations.DtoField;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

import java.util.*;

/**
 * Domain models shared by the unit tests.
 */
public final class Models {

    private Models() {
    }

    public record Address(String street, String city, String country) {
    }

    public record Person(String name, int age, String email, Address address) {
    }

    public record Profile(String first_name, String last_name) {
    }

    public record Account(@DtoField(mark = "read-only") UUID id,
                          String username,
                          @DtoField(mark = "write-only") String password,
                          @DtoField(mark = "private") String passwordHash) {
    }

    public record Secretive(String name, String _token) {
    }

    public record Audited(String name, @DtoField(dtoFor = "return") String createdBy) {
    }

    public record Ignoring(String name, @DtoField(ignore = true) String cache) {
    }

    public record BadMark(@DtoField(mark = "hidden") String name) {
    }

    public record Node(String label, Node child) {
    }

    public record Tree(String label, List<Tree> children) {
    }

    public record Item(String name, double cost) {
    }

    public record Inventory(String owner, List<Item> items, Map.Entry<String, Item> featured) {
    }

    public sealed interface Shape permits Circle, Square {
    }

    public record Circle(double radius) implements Shape {
    }

    public record Square(double side) implements Shape {
    }

    public record Drawing(String title, Shape shape, Optional<Address> location) {
    }

    public record Team(String name,
                       List<Person> members,
                       Set<String> tags,
                       Map<String, Address> offices,
                       Map.Entry<String, Address> headquarters) {
    }

    public record Box<T>(T value, String label) {
    }

    public record Signup(@NotBlank String username, @Email String email) {
    }

    public enum Color {RED, GREEN}

    public record Palette(UUID id, Color primary, Optional<String> note, int[] weights) {
    }

    public static class Pet {
        private String name;
        private int age = 1;
        private List<String> tags = new ArrayList<>();

        public Pet() {
        }

        public Pet(String name, int age) {
            this.name = name;
            this.age = age;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public int getAge() {
            return age;
        }

        public void setAge(int age) {
            this.age = age;
        }

        public List<String> getTags() {
            return tags;
        }

        public void setTags(List<String> tags) {
            this.tags = tags;
        }
    }

    /** {@code kind} has a getter only. */
    public static class Tagged {
        private final String kind = "pet";
        private String name;

        public String getKind() {
            return kind;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }
    }

    public static class Customer {
        private String name;
        private String email;

        public Customer() {
        }

        public Customer(String name, String email) {
            this.name = name;
            this.email = email;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getEmail() {
            return email;
        }

        public void setEmail(String email) {
            this.email = email;
        }
    }

    public static Person peter() {
        return new Person("peter", 30, "peter@example.com", new Address("Main St", "London", "UK"));
    }
}
