package io.github.flameyossnowy.asyncodm.mongodb.models;

import io.github.flameyossnowy.asyncodm.api.Ref;
import io.github.flameyossnowy.asyncodm.api.annotations.Index;
import io.github.flameyossnowy.asyncodm.api.annotations.NonNull;
import io.github.flameyossnowy.asyncodm.api.annotations.Reference;
import io.github.flameyossnowy.asyncodm.api.annotations.Repository;
import io.github.flameyossnowy.asyncodm.api.annotations.enums.DeleteRule;
import org.bson.types.ObjectId;

import java.util.List;

@Repository
@Index(name = "title_views", fields = {"title", "-views"})
public class Post {
    public ObjectId id;

    @NonNull
    public String title;

    public int views;

    @Reference(onDelete = DeleteRule.CASCADE)
    public Ref<User> author;

    @Reference(onDelete = DeleteRule.PULL)
    public List<Ref<User>> likedBy;

    @Reference(onDelete = DeleteRule.NULLIFY)
    public Ref<Category> category;

    @Reference(onDelete = DeleteRule.DENY)
    public Ref<Blog> blog;

    public List<Comment> comments;

    public List<String> tags;

    public Post() {}

    public Post(String title, User author) {
        this.title = title;
        this.author = Ref.of(author);
    }
}
