package com.blogicum.admin.application.service;

import com.blogicum.admin.application.port.in.CreateCategoryUseCase;
import com.blogicum.admin.application.port.in.GetStatsUseCase;
import com.blogicum.admin.application.port.in.SetCategoryPublishedUseCase;
import com.blogicum.admin.application.port.out.AdminDataPort;
import com.blogicum.admin.application.port.out.AdminDataPort.DataCounts;
import com.blogicum.application.port.out.CategoryRepository;
import com.blogicum.application.port.out.IdGenerator;
import com.blogicum.domain.error.BlogError;
import com.blogicum.domain.error.ValidationError.CategoryError;
import com.blogicum.domain.model.Actor;
import com.blogicum.domain.model.Category;
import com.blogicum.domain.model.Result;
import com.blogicum.domain.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Category management for staff users. Categories are otherwise read-only through the API.
 */
@Service
public class AdminService implements CreateCategoryUseCase, SetCategoryPublishedUseCase, GetStatsUseCase {

    private static final Logger log = LoggerFactory.getLogger(AdminService.class);

    private final AdminDataPort adminDataPort;
    private final CategoryRepository categoryRepository;
    private final IdGenerator idGenerator;
    private final Clock clock;

    public AdminService(
            AdminDataPort adminDataPort,
            CategoryRepository categoryRepository,
            IdGenerator idGenerator,
            Clock clock) {
        this.adminDataPort = adminDataPort;
        this.categoryRepository = categoryRepository;
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    @Override
    @Transactional
    public Result<Category, BlogError> createCategory(
            Actor actor, String title, String description, String slug, boolean published) {
        var staff = requireStaff(actor);
        if (staff.isFailure()) {
            return staff.castFailure();
        }
        if (slug != null && categoryRepository.existsBySlug(slug)) {
            log.warn("Category slug already taken: {}", slug);
            return Result.failure(BlogError.invalid(new CategoryError.SlugTaken(slug)));
        }

        Result<Category, BlogError> created = Category
            .create(idGenerator.generate(), title, description, slug, published, clock.instant())
            .mapError(BlogError::invalid);
        if (created.isSuccess()) {
            categoryRepository.save(created.getOrThrow());
            log.info("Category created: slug={}, published={}, by={}",
                slug, published, staff.getOrThrow().username());
        }
        return created;
    }

    @Override
    @Transactional
    public Result<Category, BlogError> setCategoryPublished(Actor actor, String slug, boolean published) {
        var staff = requireStaff(actor);
        if (staff.isFailure()) {
            return staff.castFailure();
        }
        var category = categoryRepository.findBySlug(slug);
        if (category.isEmpty()) {
            return Result.failure(new BlogError.CategoryNotFound(slug));
        }

        Category changed = category.get().withPublished(published);
        categoryRepository.update(changed);
        log.info("Category {} published={} by {}", slug, published, staff.getOrThrow().username());
        return Result.success(changed);
    }

    @Override
    @Transactional(readOnly = true)
    public DataCounts getStats() {
        return adminDataPort.getCounts();
    }

    private Result<User, BlogError> requireStaff(Actor actor) {
        var user = actor.user();
        if (user.isEmpty()) {
            return Result.failure(BlogError.AuthenticationRequired.INSTANCE);
        }
        if (!user.get().staff()) {
            log.warn("Non-staff user {} attempted category administration", user.get().username());
            return Result.failure(new BlogError.Forbidden("Category administration requires a staff account"));
        }
        return Result.success(user.get());
    }
}
